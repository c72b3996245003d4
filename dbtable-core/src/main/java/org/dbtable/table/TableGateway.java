package org.dbtable.table;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.dbtable.config.DdlFailurePolicy;
import org.dbtable.exception.DdlExecutionException;
import org.dbtable.exception.RowTypeMismatchException;
import org.dbtable.exception.StatementPreparationException;
import org.dbtable.exception.TableConfigurationException;
import org.dbtable.jdbc.DatabaseConnection;
import org.dbtable.jdbc.ExecutionError;
import org.dbtable.jdbc.PreparedSql;
import org.dbtable.schema.ColumnField;
import org.dbtable.schema.ColumnSchema;
import org.dbtable.schema.SchemaRegistry;
import org.dbtable.sql.SqlBuilder;
import org.dbtable.sql.SqlStatement;
import org.dbtable.sql.TableReferences;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for one database table.
 *
 * <p>A subclass declares the table's schema name and its ordered columns;
 * this class derives the SQL for lookups, inserts, updates, deletes and
 * CREATE/ALTER from that declaration and mediates between rows and the
 * connection.</p>
 *
 * <pre>{@code
 * public class EmployeeTable extends TableGateway<EmployeeRow> {
 *     public EmployeeTable(Database db) { super(db, EmployeeRow::new); }
 *     public String schemaName() { return "SAMPLE"; }
 *     protected List<ColumnSchema> columns() { return List.of(...); }
 * }
 * }</pre>
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>Declaration and usage mistakes raise {@link TableConfigurationException}.</li>
 *   <li>SQL the connection cannot prepare raises {@link StatementPreparationException}.</li>
 *   <li>A failed execution is retained and exposed by {@link #lastError()}; the
 *       call returns an empty list or an empty optional instead of throwing.</li>
 *   <li>DDL failures follow the configured {@link DdlFailurePolicy}.</li>
 * </ul>
 *
 * <p>Single-threaded: one gateway per connection owner, no internal locking.</p>
 *
 * @param <R> the row type of this table
 */
@Slf4j
public abstract class TableGateway<R extends Row> {

    private static final String TABLE_CLASS_SUFFIX = "TABLE";

    private final Database database;
    private final RowFactory<R> rowFactory;

    private SchemaRegistry schema;
    private SqlBuilder sqlBuilder;
    private String tableName;
    private String fullTableName;
    private ExecutionError lastError;

    /**
     * @param database the owning database
     * @param rowConstructor creates this table's row type; {@code Row::new} for the base row type
     */
    protected TableGateway(Database database, RowConstructor<R> rowConstructor) {
        if (database == null) {
            throw new TableConfigurationException("Need the database as parameter");
        }
        this.database = database;
        this.rowFactory = new RowFactory<>(this, rowConstructor, database.getConfiguration().isTrimTrailingWhitespace());
    }

    /**
     * The ordered column declarations. Read once and cached.
     */
    protected abstract List<ColumnSchema> columns();

    /**
     * The schema this table lives in.
     */
    public abstract String schemaName();

    /**
     * Override to return false for a table with no primary column. Without a
     * primary column, save always inserts and update, delete and findById are unavailable.
     */
    protected boolean hasPrimaryColumn() {
        return true;
    }

    /**
     * The table name without schema. Defaults to the class's simple name,
     * upper-cased, with a trailing {@code Table} removed.
     *
     * @throws TableConfigurationException if the class is named just {@code Table}
     */
    public String tableName() {
        if (tableName == null) {
            String name = getClass().getSimpleName().toUpperCase(Locale.ROOT);
            if (name.endsWith(TABLE_CLASS_SUFFIX)) {
                name = name.substring(0, name.length() - TABLE_CLASS_SUFFIX.length());
            }
            if (name.isEmpty()) {
                throw new TableConfigurationException(getClass().getName() + " must override tableName()");
            }
            tableName = name;
        }
        return tableName;
    }

    /**
     * {@code SCHEMA.TABLE}, upper-cased.
     */
    public final String fullTableName() {
        if (fullTableName == null) {
            String schemaName = schemaName();
            if (StringUtils.isBlank(schemaName)) {
                throw new TableConfigurationException(getClass().getName() + " must return a schema name");
            }
            fullTableName = (schemaName.trim() + "." + tableName()).toUpperCase(Locale.ROOT);
        }
        return fullTableName;
    }

    public Database getDatabase() {
        return database;
    }

    protected DatabaseConnection connection() {
        return database.getConnection();
    }

    // Schema introspection

    public SchemaRegistry schema() {
        if (schema == null) {
            schema = new SchemaRegistry(this::columns, hasPrimaryColumn());
        }
        return schema;
    }

    protected SqlBuilder sql() {
        if (sqlBuilder == null) {
            sqlBuilder = new SqlBuilder(schema(), new TableReferences(fullTableName(), database),
                    database.getConfiguration());
        }
        return sqlBuilder;
    }

    public List<String> columnList() {
        return schema().columnList();
    }

    public Map<String, ColumnSchema> columnsByName() {
        return schema().columnsByName();
    }

    public Optional<ColumnSchema> getColumn(String name) {
        return schema().getColumn(name);
    }

    public Optional<Object> getColumn(String name, ColumnField field) {
        return schema().getColumn(name, field);
    }

    public Optional<String> primaryColumn() {
        return schema().primaryColumn();
    }

    public Optional<String> identityColumn() {
        return schema().identityColumn();
    }

    /**
     * Drops the cached schema derivations; the next use re-reads {@link #columns()}.
     */
    public void resetSchema() {
        schema().reset();
    }

    /**
     * The error of the last failed execution, cleared when the next statement executes.
     */
    public Optional<ExecutionError> lastError() {
        return Optional.ofNullable(lastError);
    }

    // Raw queries

    /**
     * {@code SELECT <columns> FROM <this table> [WHERE <where>]}.
     *
     * @param where predicate with bind markers, may contain table placeholders; null or empty for none
     * @return positional rows, empty if execution failed
     */
    public List<List<Object>> select(String columns, String where, Object... binds) {
        return query(sql().select(columns, where, binds));
    }

    public List<List<Object>> selectDistinct(String columns, String where, Object... binds) {
        return query(sql().selectDistinct(columns, where, binds));
    }

    /**
     * SELECT over joined tables. {@code !!!} in the table text stands for this
     * table and {@code !name!} for any other registered table.
     */
    public List<List<Object>> selectJoin(String columns, String tables, String where, Object... binds) {
        return query(sql().selectJoin(columns, tables, where, binds));
    }

    // Counting

    /**
     * @return the number of rows, empty if execution failed
     */
    public OptionalLong count() {
        return firstNumber(select("COUNT(*)", null));
    }

    public OptionalLong countWhere(String where, Object... binds) {
        return firstNumber(select("COUNT(*)", where, binds));
    }

    // Finding rows

    /**
     * Rows whose primary column matches any of the values.
     *
     * @throws TableConfigurationException if the table has no primary column
     */
    public List<R> findById(Object... ids) {
        if (primaryColumn().isEmpty()) {
            throw new TableConfigurationException(fullTableName() + " has no primary column");
        }
        if (ids.length == 0) {
            return Collections.emptyList();
        }
        return findWhere(sql().primaryKeyListPredicate(ids.length), ids);
    }

    public List<R> findWhere(String where, Object... binds) {
        return findJoin(fullTableName(), where, binds);
    }

    /**
     * Distinct rows of this table selected from joined tables. When the join
     * text aliases this table ({@code !!! AS E}), selected columns are
     * qualified with that alias.
     */
    public List<R> findJoin(String tables, String where, Object... binds) {
        String columns = sql().columnSelection(aliasPrefix(tables));
        return rowFactory.fromResults(query(sql().selectDistinctJoin(columns, tables, where, binds)));
    }

    /**
     * The first matching row, if any.
     */
    public Optional<R> findOne(String where, Object... binds) {
        List<R> rows = findWhere(where, binds);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public FindResult<R> lookupById(Object... ids) {
        return FindResult.of(findById(ids));
    }

    public FindResult<R> lookupWhere(String where, Object... binds) {
        return FindResult.of(findWhere(where, binds));
    }

    public FindResult<R> lookupJoin(String tables, String where, Object... binds) {
        return FindResult.of(findJoin(tables, where, binds));
    }

    private String aliasPrefix(String tables) {
        if (StringUtils.isEmpty(tables)) {
            return "";
        }
        for (Pattern pattern : aliasPatterns()) {
            Matcher matcher = pattern.matcher(tables);
            if (matcher.find()) {
                return matcher.group(1) + ".";
            }
        }
        return "";
    }

    private List<Pattern> aliasPatterns() {
        String as = "\\s+[Aa][Ss]\\s+(\\w+)";
        return List.of(
                Pattern.compile("!!!" + as),
                Pattern.compile(Pattern.quote(fullTableName()) + as),
                Pattern.compile(Pattern.quote(tableName()) + as));
    }

    // Row lifecycle

    /**
     * A new, unsaved row holding each column's declared default. Identity
     * values are left to the database.
     */
    public R createRow() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        for (ColumnSchema column : schema().declarations()) {
            defaults.put(column.getName(), column.getDefaultValue());
        }
        return rowFactory.fromValues(defaults);
    }

    /**
     * Inserts the row if no stored row has its primary-key value, otherwise
     * updates the row's modified columns. The dirty set is cleared on success.
     *
     * <p>Existence is decided by counting stored rows with the same primary-key
     * value, so a new row that collides with a stored key is written as an update.
     * Callers that know their intent use {@link #insert} or {@link #update}.</p>
     *
     * @return rows affected, 0 when there was nothing to update, empty if execution failed
     * @throws RowTypeMismatchException if the row belongs to another table
     */
    public OptionalInt save(Row row) {
        checkOwnership(row, "save");

        OptionalLong existing = storedCount(row);
        if (existing.isEmpty()) {
            return OptionalInt.empty();
        }
        if (existing.getAsLong() > 0) {
            log.debug("{} already holds {}, updating", fullTableName(), row.primaryColumnValue());
            return writeUpdate(row);
        }
        return writeInsert(row);
    }

    /**
     * Inserts the row without looking for a stored row with the same primary-key value.
     *
     * @return rows affected, empty if execution failed
     * @throws RowTypeMismatchException if the row belongs to another table
     */
    public OptionalInt insert(Row row) {
        checkOwnership(row, "insert");
        return writeInsert(row);
    }

    /**
     * Writes the row's modified columns to the stored row with its primary-key value.
     *
     * @return rows affected, 0 when nothing but the primary key changed, empty if execution failed
     * @throws RowTypeMismatchException if the row belongs to another table
     * @throws TableConfigurationException if the table has no primary column
     */
    public OptionalInt update(Row row) {
        checkOwnership(row, "update");
        if (primaryColumn().isEmpty()) {
            throw new TableConfigurationException(fullTableName() + " has no primary column");
        }
        return writeUpdate(row);
    }

    /**
     * Deletes the stored row with the row's primary-key value, if there is one.
     *
     * @return rows affected, 0 when nothing was stored, empty if execution failed
     * @throws RowTypeMismatchException if the row belongs to another table
     */
    public OptionalInt delete(Row row) {
        checkOwnership(row, "delete");

        OptionalLong existing = storedCount(row);
        if (existing.isEmpty()) {
            return OptionalInt.empty();
        }
        if (existing.getAsLong() == 0) {
            return OptionalInt.of(0);
        }

        Optional<SqlStatement> delete = sql().delete(row.primaryColumnValue());
        return delete.isPresent() ? executeUpdate(delete.get()) : OptionalInt.of(0);
    }

    public void commit() throws SQLException {
        connection().commit();
    }

    public void rollback() throws SQLException {
        connection().rollback();
    }

    private void checkOwnership(Row row, String operation) {
        if (row == null) {
            throw new RowTypeMismatchException("Cannot " + operation + " a null row in " + fullTableName());
        }
        if (row.getTable() != this) {
            throw new RowTypeMismatchException("Got a row of " + row.getTable().fullTableName() +
                    " which isn't a row of " + fullTableName());
        }
    }

    private OptionalInt writeInsert(Row row) {
        return markSavedOnSuccess(row, executeUpdate(sql().insert(row.values())));
    }

    private OptionalInt writeUpdate(Row row) {
        Optional<SqlStatement> update = sql().update(row.values(), row.modifiedColumns());
        return markSavedOnSuccess(row, update.isPresent() ? executeUpdate(update.get()) : OptionalInt.of(0));
    }

    private static OptionalInt markSavedOnSuccess(Row row, OptionalInt result) {
        if (result.isPresent()) {
            row.markSaved();
        }
        return result;
    }

    private OptionalLong storedCount(Row row) {
        if (primaryColumn().isEmpty()) {
            return OptionalLong.of(0);
        }
        Optional<SqlStatement> count = sql().countByPrimaryKey(row.primaryColumnValue());
        return count.isPresent() ? firstNumber(query(count.get())) : OptionalLong.of(0);
    }

    // Schema provisioning

    /**
     * Whether the table exists in the database.
     *
     * @throws IllegalStateException if more than one table has this schema and name
     */
    public boolean tableExists() throws SQLException {
        List<String> matches = connection().listTables(schemaName().trim().toUpperCase(Locale.ROOT), tableName());
        if (matches.size() > 1) {
            throw new IllegalStateException("Unexpected - more than one table named " + fullTableName() + ": " + matches);
        }
        return !matches.isEmpty();
    }

    /**
     * The live column names of the table, empty if it does not exist.
     */
    public List<String> currentColumns() throws SQLException {
        if (!tableExists()) {
            return Collections.emptyList();
        }

        String query = sql().emptySelect();
        PreparedSql prepared = prepare(query);
        try {
            connection().execute(prepared, Collections.emptyList());
            return connection().columnNames(prepared);
        } finally {
            close(prepared);
        }
    }

    /**
     * Creates the table if it does not exist, otherwise adds any declared
     * columns it lacks. {@link #onProvisioned} runs after each successful change.
     *
     * @throws SQLException if the live table cannot be inspected
     * @throws DdlExecutionException if a DDL statement fails under the FAIL_FAST policy
     */
    public void ensureSchema() throws SQLException {
        List<String> current = currentColumns();

        if (current.isEmpty()) {
            String create = sql().createTable();
            log.info("{}", create);
            if (executeDdl(create)) {
                onProvisioned(ProvisioningEvent.created(columnList()));
            }
            return;
        }

        Set<String> present = new HashSet<>();
        for (String column : current) {
            present.add(column.toUpperCase(Locale.ROOT));
        }
        List<String> missing = new ArrayList<>();
        for (String column : columnList()) {
            if (!present.contains(column)) {
                missing.add(column);
            }
        }
        if (missing.isEmpty()) {
            log.debug("{} is up to date", fullTableName());
            return;
        }

        List<String> statements = sql().alterAdd(missing);
        List<String> added = new ArrayList<>();
        for (int i = 0; i < statements.size(); i++) {
            log.info("{}", statements.get(i));
            if (executeDdl(statements.get(i))) {
                added.add(missing.get(i));
            }
        }
        if (!added.isEmpty()) {
            onProvisioned(ProvisioningEvent.altered(added));
        }
    }

    /**
     * Runs once after ensureSchema created the table or added columns to it.
     *
     * <p>The default grants SELECT, INSERT, UPDATE and DELETE to the configured
     * default grantee ({@code NOBODY} unless configured otherwise) after CREATE,
     * and does nothing after ALTER. Granting needs administrative authority on
     * the database. Override to do anything else, including nothing.</p>
     */
    protected void onProvisioned(ProvisioningEvent event) {
        String grantee = database.getConfiguration().getDefaultGrantee();
        if (event.isCreated() && !grantee.isEmpty()) {
            executeDdl(sql().grantAll(grantee));
        }
    }

    /**
     * Executes one DDL statement under the configured failure policy.
     *
     * @return whether the statement succeeded
     * @throws DdlExecutionException on failure under FAIL_FAST
     */
    protected boolean executeDdl(String ddl) {
        try {
            connection().executeImmediate(ddl);
            return true;
        } catch (SQLException e) {
            lastError = ExecutionError.from(e, ddl);
            if (database.getConfiguration().getDdlFailurePolicy() == DdlFailurePolicy.FAIL_FAST) {
                throw new DdlExecutionException(ddl, e);
            }
            log.error("{}", lastError.describe());
            return false;
        }
    }

    // Statement plumbing

    private PreparedSql prepare(String sql) {
        log.debug("{}", sql);
        try {
            return connection().prepare(sql);
        } catch (SQLException e) {
            throw new StatementPreparationException(sql, e);
        }
    }

    /**
     * @return the update count, empty after recording the error if execution failed
     */
    private OptionalInt execute(PreparedSql prepared, List<Object> binds) {
        lastError = null;
        try {
            return OptionalInt.of(connection().execute(prepared, binds));
        } catch (SQLException e) {
            recordFailure(e, prepared.getSql());
            return OptionalInt.empty();
        }
    }

    private List<List<Object>> query(SqlStatement statement) {
        PreparedSql prepared = prepare(statement.getSql());
        try {
            if (execute(prepared, statement.getBinds()).isEmpty()) {
                return Collections.emptyList();
            }
            return connection().fetchAll(prepared);
        } catch (SQLException e) {
            recordFailure(e, statement.getSql());
            return Collections.emptyList();
        } finally {
            close(prepared);
        }
    }

    private OptionalInt executeUpdate(SqlStatement statement) {
        PreparedSql prepared = prepare(statement.getSql());
        try {
            return execute(prepared, statement.getBinds());
        } finally {
            close(prepared);
        }
    }

    private void recordFailure(SQLException e, String sql) {
        lastError = ExecutionError.from(e, sql);
        log.warn("Statement failed [{}]: {}", sql, lastError.describe());
    }

    private void close(PreparedSql prepared) {
        try {
            prepared.close();
        } catch (SQLException e) {
            log.warn("Failed to close statement [{}]: {}", prepared.getSql(), e.getMessage());
        }
    }

    private static OptionalLong firstNumber(List<List<Object>> rows) {
        if (rows.isEmpty() || rows.get(0).isEmpty()) {
            return OptionalLong.empty();
        }
        Object value = rows.get(0).get(0);
        if (value instanceof Number) {
            return OptionalLong.of(((Number) value).longValue());
        }
        return value == null ? OptionalLong.empty() : OptionalLong.of(Long.parseLong(value.toString().trim()));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + fullTableName() + "]";
    }
}
