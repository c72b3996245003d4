package org.dbtable.config;

/**
 * Holds constants shared by the SQL builder, the table gateway and the configuration.
 */
public class DbTableConstants {
    public static final String PROPERTIES_RESOURCE = "dbtable.properties";

    // Configuration property keys
    public static final String DDL_FAILURE_POLICY_PROPERTY = "dbtable.ddl.failurePolicy";
    public static final String DDL_TABLE_OPTIONS_PROPERTY = "dbtable.ddl.tableOptions";
    public static final String DDL_DEFAULT_GRANTEE_PROPERTY = "dbtable.ddl.defaultGrantee";
    public static final String ROW_TRIM_TRAILING_WHITESPACE_PROPERTY = "dbtable.row.trimTrailingWhitespace";

    // Defaults
    public static final DdlFailurePolicy DEFAULT_DDL_FAILURE_POLICY = DdlFailurePolicy.BEST_EFFORT;
    public static final String DEFAULT_TABLE_OPTIONS = "DATA CAPTURE NONE";
    public static final String DEFAULT_GRANTEE = "NOBODY";
    public static final boolean DEFAULT_TRIM_TRAILING_WHITESPACE = true;

    // DDL fragments that deployed schemas depend on verbatim
    public static final String IDENTITY_CLAUSE = "GENERATED ALWAYS AS IDENTITY";
    public static final String DEFAULT_IDENTITY_DIRECTIVE = "(START WITH 0, INCREMENT BY 1, NO CACHE)";
    public static final String DEFAULT_IDENTITY_KEYWORD = "default";
    public static final String BOOL_PSEUDO_TYPE = "BOOL";
    public static final String BOOL_STORAGE_TYPE = "CHAR";
    public static final String BOOL_TRUE = "Y";
    public static final String BOOL_FALSE = "N";

    private DbTableConstants() {
    }
}
