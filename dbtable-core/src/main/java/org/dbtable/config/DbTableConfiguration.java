package org.dbtable.config;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

import static org.dbtable.config.DbTableConstants.DDL_DEFAULT_GRANTEE_PROPERTY;
import static org.dbtable.config.DbTableConstants.DDL_FAILURE_POLICY_PROPERTY;
import static org.dbtable.config.DbTableConstants.DDL_TABLE_OPTIONS_PROPERTY;
import static org.dbtable.config.DbTableConstants.DEFAULT_DDL_FAILURE_POLICY;
import static org.dbtable.config.DbTableConstants.DEFAULT_GRANTEE;
import static org.dbtable.config.DbTableConstants.DEFAULT_TABLE_OPTIONS;
import static org.dbtable.config.DbTableConstants.DEFAULT_TRIM_TRAILING_WHITESPACE;
import static org.dbtable.config.DbTableConstants.PROPERTIES_RESOURCE;
import static org.dbtable.config.DbTableConstants.ROW_TRIM_TRAILING_WHITESPACE_PROPERTY;

/**
 * Immutable settings for table gateways owned by one database.
 *
 * <p>Instances are built with {@link #builder()} or loaded with {@link #load()}.
 * When loading, values are resolved in the following order (later wins):</p>
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>a {@code dbtable.properties} file on the classpath</li>
 *   <li>environment variables (dots converted to underscores, upper-cased)</li>
 *   <li>JVM system properties (e.g. {@code -Ddbtable.ddl.failurePolicy=FAIL_FAST})</li>
 * </ol>
 *
 * <pre>{@code
 * DbTableConfiguration config = DbTableConfiguration.builder()
 *     .ddlFailurePolicy(DdlFailurePolicy.FAIL_FAST)
 *     .tableOptions("")
 *     .defaultGrantee("")
 *     .build();
 * }</pre>
 */
@Slf4j
public final class DbTableConfiguration {

    private final DdlFailurePolicy ddlFailurePolicy;
    private final String tableOptions;
    private final String defaultGrantee;
    private final boolean trimTrailingWhitespace;

    private DbTableConfiguration(Builder builder) {
        this.ddlFailurePolicy = builder.ddlFailurePolicy;
        this.tableOptions = builder.tableOptions != null ? builder.tableOptions.trim() : "";
        this.defaultGrantee = builder.defaultGrantee != null ? builder.defaultGrantee.trim() : "";
        this.trimTrailingWhitespace = builder.trimTrailingWhitespace;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with every setting at its default.
     */
    public static DbTableConfiguration defaults() {
        return builder().build();
    }

    /**
     * Loads configuration from the classpath properties file, environment and system properties.
     *
     * @return the resolved configuration
     */
    public static DbTableConfiguration load() {
        Properties fileProperties = loadPropertiesFile();

        DbTableConfiguration config = builder()
                .ddlFailurePolicy(getPolicyProperty(fileProperties, DDL_FAILURE_POLICY_PROPERTY,
                        DEFAULT_DDL_FAILURE_POLICY))
                .tableOptions(getStringProperty(fileProperties, DDL_TABLE_OPTIONS_PROPERTY, DEFAULT_TABLE_OPTIONS))
                .defaultGrantee(getStringProperty(fileProperties, DDL_DEFAULT_GRANTEE_PROPERTY, DEFAULT_GRANTEE))
                .trimTrailingWhitespace(getBooleanProperty(fileProperties, ROW_TRIM_TRAILING_WHITESPACE_PROPERTY,
                        DEFAULT_TRIM_TRAILING_WHITESPACE))
                .build();

        log.debug("Loaded table configuration: {}", config);
        return config;
    }

    /**
     * Load the raw dbtable.properties file from classpath.
     *
     * @return properties from the file, empty if there is none
     */
    static Properties loadPropertiesFile() {
        Properties properties = new Properties();

        try (InputStream is = DbTableConfiguration.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (is != null) {
                properties.load(is);
                log.debug("Loaded {} from classpath", PROPERTIES_RESOURCE);
            }
        } catch (IOException e) {
            log.warn("Could not read {} from classpath: {}", PROPERTIES_RESOURCE, e.getMessage());
        }

        return properties;
    }

    /**
     * Gets a string property value. JVM system properties take precedence over
     * environment variables, which take precedence over the properties file.
     */
    private static String getStringProperty(Properties fileProperties, String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value != null) {
            log.debug("Using JVM property {}={}", key, value);
            return value;
        }

        String envKey = key.replace('.', '_').toUpperCase();
        value = System.getenv(envKey);
        if (value != null) {
            log.debug("Using environment variable {}={}", envKey, value);
            return value;
        }

        value = fileProperties.getProperty(key);
        if (value != null) {
            log.debug("Using {} value {}={}", PROPERTIES_RESOURCE, key, value);
            return value;
        }

        return defaultValue;
    }

    private static boolean getBooleanProperty(Properties fileProperties, String key, boolean defaultValue) {
        String value = getStringProperty(fileProperties, key, String.valueOf(defaultValue)).trim();
        if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
            log.warn("Invalid boolean value for property '{}': {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
        return Boolean.parseBoolean(value);
    }

    private static DdlFailurePolicy getPolicyProperty(Properties fileProperties, String key,
                                                      DdlFailurePolicy defaultValue) {
        String value = getStringProperty(fileProperties, key, defaultValue.name()).trim();
        String normalized = value.toUpperCase(Locale.ROOT).replace('-', '_');
        for (DdlFailurePolicy policy : DdlFailurePolicy.values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        log.warn("Invalid DDL failure policy for property '{}': {}, using default: {}", key, value, defaultValue);
        return defaultValue;
    }

    public DdlFailurePolicy getDdlFailurePolicy() {
        return ddlFailurePolicy;
    }

    /**
     * Table-level option suffix appended after the column list of CREATE TABLE.
     *
     * @return the suffix, empty when none should be emitted
     */
    public String getTableOptions() {
        return tableOptions;
    }

    /**
     * User granted full DML authority by the default provisioning hook.
     *
     * @return the grantee, empty when the grant is disabled
     */
    public String getDefaultGrantee() {
        return defaultGrantee;
    }

    public boolean isTrimTrailingWhitespace() {
        return trimTrailingWhitespace;
    }

    @Override
    public String toString() {
        return "DbTableConfiguration{" +
                "ddlFailurePolicy=" + ddlFailurePolicy +
                ", tableOptions='" + tableOptions + '\'' +
                ", defaultGrantee='" + defaultGrantee + '\'' +
                ", trimTrailingWhitespace=" + trimTrailingWhitespace +
                '}';
    }

    /**
     * Builder for DbTableConfiguration instances.
     */
    public static final class Builder {
        private DdlFailurePolicy ddlFailurePolicy = DEFAULT_DDL_FAILURE_POLICY;
        private String tableOptions = DEFAULT_TABLE_OPTIONS;
        private String defaultGrantee = DEFAULT_GRANTEE;
        private boolean trimTrailingWhitespace = DEFAULT_TRIM_TRAILING_WHITESPACE;

        private Builder() {
        }

        public Builder ddlFailurePolicy(DdlFailurePolicy ddlFailurePolicy) {
            this.ddlFailurePolicy = ddlFailurePolicy != null ? ddlFailurePolicy : DEFAULT_DDL_FAILURE_POLICY;
            return this;
        }

        public Builder tableOptions(String tableOptions) {
            this.tableOptions = tableOptions;
            return this;
        }

        public Builder defaultGrantee(String defaultGrantee) {
            this.defaultGrantee = defaultGrantee;
            return this;
        }

        public Builder trimTrailingWhitespace(boolean trimTrailingWhitespace) {
            this.trimTrailingWhitespace = trimTrailingWhitespace;
            return this;
        }

        public DbTableConfiguration build() {
            return new DbTableConfiguration(this);
        }
    }
}
