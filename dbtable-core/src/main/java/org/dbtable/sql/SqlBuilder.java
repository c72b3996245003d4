package org.dbtable.sql;

import org.apache.commons.lang3.StringUtils;
import org.dbtable.config.DbTableConfiguration;
import org.dbtable.exception.TableConfigurationException;
import org.dbtable.schema.ColumnSchema;
import org.dbtable.schema.SchemaRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.dbtable.config.DbTableConstants.BOOL_FALSE;
import static org.dbtable.config.DbTableConstants.BOOL_PSEUDO_TYPE;
import static org.dbtable.config.DbTableConstants.BOOL_STORAGE_TYPE;
import static org.dbtable.config.DbTableConstants.BOOL_TRUE;
import static org.dbtable.config.DbTableConstants.DEFAULT_IDENTITY_DIRECTIVE;
import static org.dbtable.config.DbTableConstants.IDENTITY_CLAUSE;

/**
 * Builds the SQL a table gateway issues, from the table's schema registry.
 *
 * <p>The builder never executes anything. Every value in WHERE, SET or VALUES
 * position is a bind marker; primary-key matches use {@code <column> IN ?}
 * with a single bind, which the connection must accept.</p>
 *
 * <p>DDL text is kept byte-compatible with deployed schemas: column
 * definitions, the BOOL check constraint and the default identity directive
 * must not change shape.</p>
 */
public class SqlBuilder {

    private final SchemaRegistry schema;
    private final TableReferences references;
    private final DbTableConfiguration configuration;

    public SqlBuilder(SchemaRegistry schema, TableReferences references, DbTableConfiguration configuration) {
        this.schema = schema;
        this.references = references;
        this.configuration = configuration;
    }

    public String fullTableName() {
        return references.getFullTableName();
    }

    // queries

    /**
     * {@code SELECT <columns> FROM <table> [WHERE <where>]}.
     */
    public SqlStatement select(String columns, String where, Object... binds) {
        return buildSelect(false, columns, fullTableName(), where, binds);
    }

    /**
     * Same as {@link #select} with {@code DISTINCT} after {@code SELECT}.
     */
    public SqlStatement selectDistinct(String columns, String where, Object... binds) {
        return buildSelect(true, columns, fullTableName(), where, binds);
    }

    /**
     * {@code SELECT <columns> FROM <tables> [WHERE <where>]} where the table
     * text may join other tables through placeholders.
     */
    public SqlStatement selectJoin(String columns, String tables, String where, Object... binds) {
        return buildSelect(false, columns, references.substitute(tables), where, binds);
    }

    public SqlStatement selectDistinctJoin(String columns, String tables, String where, Object... binds) {
        return buildSelect(true, columns, references.substitute(tables), where, binds);
    }

    private SqlStatement buildSelect(boolean distinct, String columns, String from, String where, Object[] binds) {
        StringBuilder sql = new StringBuilder("SELECT ");
        if (distinct) {
            sql.append("DISTINCT ");
        }
        sql.append(columns).append(" FROM ").append(from);
        if (StringUtils.isNotEmpty(where)) {
            sql.append(" WHERE ").append(references.substitute(where));
        }
        return new SqlStatement(sql.toString(), binds);
    }

    /**
     * Counts rows whose primary column matches the value; empty when the table has no primary column.
     */
    public Optional<SqlStatement> countByPrimaryKey(Object value) {
        return schema.primaryColumn()
                .map(primary -> select("COUNT(*)", primary + " IN ?", value));
    }

    /**
     * {@code <primary> IN (?, ?, ...)} with one marker per value.
     *
     * @throws TableConfigurationException if the table has no primary column
     */
    public String primaryKeyListPredicate(int valueCount) {
        String primary = requirePrimaryColumn();
        return primary + " IN (" + String.join(", ", Collections.nCopies(valueCount, "?")) + ")";
    }

    // DML

    /**
     * INSERT of every insertable column, taking bind values from the row values.
     * No-create columns and the identity column are left out.
     */
    public SqlStatement insert(Map<String, ?> values) {
        List<String> columns = schema.insertableColumns();
        List<Object> binds = new ArrayList<>();
        for (String column : columns) {
            binds.add(values.get(column));
        }

        String sql = "INSERT INTO " + fullTableName() + " (" + String.join(", ", columns) +
                ") VALUES(" + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
        return new SqlStatement(sql, binds);
    }

    /**
     * UPDATE of the modified columns, matched on the primary column.
     * The primary column itself is never rewritten.
     *
     * @return the statement, or empty when nothing but the primary key changed
     *         or the table has no primary column
     */
    public Optional<SqlStatement> update(Map<String, ?> values, Collection<String> modifiedColumns) {
        Optional<String> primary = schema.primaryColumn();
        if (primary.isEmpty()) {
            return Optional.empty();
        }

        List<String> sets = new ArrayList<>();
        List<Object> binds = new ArrayList<>();
        for (String column : schema.columnList()) {
            if (modifiedColumns.contains(column) && !column.equals(primary.get())) {
                sets.add(column + " = ?");
                binds.add(values.get(column));
            }
        }
        if (sets.isEmpty()) {
            return Optional.empty();
        }

        binds.add(values.get(primary.get()));
        String sql = "UPDATE " + fullTableName() + " SET " + String.join(", ", sets) +
                " WHERE " + primary.get() + " IN ?";
        return Optional.of(new SqlStatement(sql, binds));
    }

    /**
     * DELETE matched on the primary column; empty when the table has no primary column.
     */
    public Optional<SqlStatement> delete(Object primaryValue) {
        return schema.primaryColumn()
                .map(primary -> new SqlStatement(
                        "DELETE FROM " + fullTableName() + " WHERE " + primary + " IN ?", primaryValue));
    }

    // DDL

    /**
     * One column definition as used by both CREATE TABLE and ALTER TABLE ADD.
     */
    public String columnDefinition(ColumnSchema column) {
        boolean bool = BOOL_PSEUDO_TYPE.equalsIgnoreCase(column.getSqlType());

        StringBuilder definition = new StringBuilder(column.getName()).append(' ');
        definition.append(bool ? BOOL_STORAGE_TYPE : column.getSqlType());
        column.length().ifPresent(length -> definition.append(" (").append(length).append(')'));
        column.options().ifPresent(options -> definition.append(' ').append(options));
        if (bool) {
            definition.append(" CHECK (").append(column.getName())
                    .append(" IN ('").append(BOOL_TRUE).append("','").append(BOOL_FALSE).append("'))");
        }
        if (column.isGeneratedIdentity()) {
            definition.append(' ').append(IDENTITY_CLAUSE).append(' ');
            String directive = column.getIdentityDirective();
            if (directive == null) {
                definition.append(DEFAULT_IDENTITY_DIRECTIVE);
            } else {
                definition.append(directive);
            }
        }
        return references.substitute(definition.toString());
    }

    /**
     * Full CREATE TABLE: column definitions, then constraints (the primary
     * key last among them), then foreign keys, then the table option suffix.
     */
    public String createTable() {
        List<String> columns = new ArrayList<>();
        List<String> constraints = new ArrayList<>();
        List<String> foreignKeys = new ArrayList<>();

        for (ColumnSchema column : schema.declarations()) {
            columns.add(columnDefinition(column));
            for (String constraint : column.getConstraints()) {
                constraints.add(references.substitute("CONSTRAINT " + constraint));
            }
            for (String reference : column.getForeignKeys()) {
                foreignKeys.add(references.substitute(
                        "FOREIGN KEY (" + column.getName() + ") REFERENCES " + reference));
            }
        }
        schema.primaryColumn().ifPresent(primary -> constraints.add("PRIMARY KEY (" + primary + ")"));

        List<String> parts = new ArrayList<>(columns);
        parts.addAll(constraints);
        parts.addAll(foreignKeys);

        StringBuilder sql = new StringBuilder("CREATE TABLE ").append(fullTableName())
                .append(" (").append(String.join(", ", parts)).append(')');
        String tableOptions = configuration.getTableOptions();
        if (!tableOptions.isEmpty()) {
            sql.append(' ').append(tableOptions);
        }
        return sql.toString();
    }

    /**
     * One {@code ALTER TABLE ... ADD <definition>} statement per column, in the order given.
     *
     * @throws TableConfigurationException if a name is not a declared column
     */
    public List<String> alterAdd(Collection<String> columnNames) {
        List<String> statements = new ArrayList<>();
        for (String name : columnNames) {
            ColumnSchema column = schema.getColumn(name)
                    .orElseThrow(() -> new TableConfigurationException(
                            "Cannot add undeclared column " + name + " to " + fullTableName()));
            statements.add("ALTER TABLE " + fullTableName() + " ADD " + columnDefinition(column));
        }
        return statements;
    }

    /**
     * A query returning no rows, used to read the live column names.
     */
    public String emptySelect() {
        return "SELECT * FROM " + fullTableName() + " WHERE 1 = 0";
    }

    /**
     * Full DML authority on this table for the given user.
     */
    public String grantAll(String grantee) {
        return "GRANT SELECT,INSERT,UPDATE,DELETE ON TABLE " + fullTableName() + " TO USER " + grantee;
    }

    private String requirePrimaryColumn() {
        return schema.primaryColumn()
                .orElseThrow(() -> new TableConfigurationException(fullTableName() + " has no primary column"));
    }

    /**
     * Column list text for SELECT, each name optionally qualified with an alias.
     */
    public String columnSelection(String prefix) {
        List<String> qualified = new ArrayList<>();
        for (String column : schema.columnList()) {
            qualified.add(prefix + column);
        }
        return String.join(", ", qualified);
    }
}
