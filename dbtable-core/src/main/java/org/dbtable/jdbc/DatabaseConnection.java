package org.dbtable.jdbc;

import java.sql.SQLException;
import java.util.List;

/**
 * The database connection a table gateway talks to.
 *
 * <p>One prepare followed by one blocking execute per operation. Timeouts,
 * cancellation and retry policy all belong to the implementation; the
 * gateways add none. A connection is owned by a single database context
 * and is not expected to be shared between threads.</p>
 */
public interface DatabaseConnection extends AutoCloseable {

    /**
     * Prepares parameterized SQL text.
     *
     * @param sql the statement text
     * @return the prepared statement
     * @throws SQLException if the database rejects the text
     */
    PreparedSql prepare(String sql) throws SQLException;

    /**
     * Executes a prepared statement with positional bind values.
     * A primary-key match written as {@code <column> IN ?} receives its value as a single bind.
     *
     * @param statement a statement from {@link #prepare}
     * @param binds bind values in marker order, null elements bind SQL NULL
     * @return the update count, or -1 if the statement produced a result set
     * @throws SQLException carrying the driver's error code, state and message
     */
    int execute(PreparedSql statement, List<?> binds) throws SQLException;

    /**
     * All rows of the result set produced by the last execution of the statement.
     *
     * @return rows in result order, each row's values in column order
     */
    List<List<Object>> fetchAll(PreparedSql statement) throws SQLException;

    /**
     * Column labels of the result set produced by the last execution of the statement.
     */
    List<String> columnNames(PreparedSql statement) throws SQLException;

    /**
     * Executes a statement without binds, for DDL and grants.
     */
    void executeImmediate(String sql) throws SQLException;

    void commit() throws SQLException;

    void rollback() throws SQLException;

    /**
     * Tables whose schema and name equal the given names. The names are
     * literal: {@code _} and {@code %} are not wildcards.
     *
     * @return one {@code SCHEMA.TABLE} entry per match
     */
    List<String> listTables(String schemaName, String tableName) throws SQLException;

    @Override
    void close() throws SQLException;
}
