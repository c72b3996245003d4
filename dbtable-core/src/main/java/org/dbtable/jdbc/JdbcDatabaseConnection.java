package org.dbtable.jdbc;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link DatabaseConnection} over a plain JDBC connection.
 *
 * <p>Binds with {@code setObject} (nulls with {@code setNull} and the
 * parameter's declared type), reads with {@code getObject} and lists
 * tables through {@link DatabaseMetaData}. Commit and rollback go straight
 * to the driver, so callers normally turn auto-commit off.</p>
 */
@Slf4j
public class JdbcDatabaseConnection implements DatabaseConnection {

    private static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};

    private final Connection connection;

    public JdbcDatabaseConnection(Connection connection) {
        this.connection = connection;
    }

    public Connection getConnection() {
        return connection;
    }

    @Override
    public PreparedSql prepare(String sql) throws SQLException {
        return new JdbcPreparedSql(sql, connection.prepareStatement(sql));
    }

    @Override
    public int execute(PreparedSql statement, List<?> binds) throws SQLException {
        JdbcPreparedSql prepared = unwrap(statement);
        PreparedStatement ps = prepared.statement;
        ps.clearParameters();
        ParameterMetaData parameters = null;
        for (int i = 0; i < binds.size(); i++) {
            Object value = binds.get(i);
            if (value != null) {
                ps.setObject(i + 1, value);
                continue;
            }
            if (parameters == null) {
                parameters = parameterMetaData(ps);
            }
            ps.setNull(i + 1, nullType(parameters, i + 1));
        }

        prepared.closeResultSet();
        if (ps.execute()) {
            prepared.resultSet = ps.getResultSet();
            return -1;
        }
        return ps.getUpdateCount();
    }

    private static ParameterMetaData parameterMetaData(PreparedStatement ps) {
        try {
            return ps.getParameterMetaData();
        } catch (SQLException e) {
            log.debug("Parameter metadata unavailable, binding nulls untyped: {}", e.getMessage());
            return null;
        }
    }

    private static int nullType(ParameterMetaData parameters, int index) {
        if (parameters == null) {
            return Types.NULL;
        }
        try {
            return parameters.getParameterType(index);
        } catch (SQLException e) {
            log.debug("No type for parameter {}, binding null untyped: {}", index, e.getMessage());
            return Types.NULL;
        }
    }

    @Override
    public List<List<Object>> fetchAll(PreparedSql statement) throws SQLException {
        JdbcPreparedSql prepared = unwrap(statement);
        List<List<Object>> rows = new ArrayList<>();
        ResultSet rs = prepared.resultSet;
        if (rs == null) {
            return rows;
        }

        int columnCount = rs.getMetaData().getColumnCount();
        while (rs.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(rs.getObject(i));
            }
            rows.add(row);
        }
        prepared.closeResultSet();
        return rows;
    }

    @Override
    public List<String> columnNames(PreparedSql statement) throws SQLException {
        JdbcPreparedSql prepared = unwrap(statement);
        ResultSetMetaData metaData = prepared.resultSet != null
                ? prepared.resultSet.getMetaData()
                : prepared.statement.getMetaData();
        List<String> names = new ArrayList<>();
        if (metaData == null) {
            return names;
        }
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            names.add(metaData.getColumnLabel(i));
        }
        return names;
    }

    @Override
    public void executeImmediate(String sql) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    @Override
    public void commit() throws SQLException {
        connection.commit();
    }

    @Override
    public void rollback() throws SQLException {
        connection.rollback();
    }

    @Override
    public List<String> listTables(String schemaName, String tableName) throws SQLException {
        List<String> tables = new ArrayList<>();
        DatabaseMetaData metaData = connection.getMetaData();
        String escape = metaData.getSearchStringEscape();
        try (ResultSet rs = metaData.getTables(null, escapePattern(schemaName, escape),
                escapePattern(tableName, escape), TABLE_TYPES)) {
            while (rs.next()) {
                String schema = rs.getString("TABLE_SCHEM");
                String table = rs.getString("TABLE_NAME");
                // drivers that ignore the escape still return pattern matches
                if (schemaName.equals(schema) && tableName.equals(table)) {
                    tables.add(schema + "." + table);
                }
            }
        }
        log.debug("Tables named {}.{}: {}", schemaName, tableName, tables);
        return tables;
    }

    static String escapePattern(String name, String escape) {
        if (escape == null || escape.isEmpty()) {
            return name;
        }
        StringBuilder escaped = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            if (c == '_' || c == '%' || escape.indexOf(c) >= 0) {
                escaped.append(escape);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }

    private static JdbcPreparedSql unwrap(PreparedSql statement) {
        if (!(statement instanceof JdbcPreparedSql)) {
            throw new IllegalArgumentException("Statement was not prepared by a JdbcDatabaseConnection: " + statement);
        }
        return (JdbcPreparedSql) statement;
    }

    private static final class JdbcPreparedSql implements PreparedSql {
        private final String sql;
        private final PreparedStatement statement;
        private ResultSet resultSet;

        private JdbcPreparedSql(String sql, PreparedStatement statement) {
            this.sql = sql;
            this.statement = statement;
        }

        @Override
        public String getSql() {
            return sql;
        }

        private void closeResultSet() throws SQLException {
            if (resultSet != null) {
                resultSet.close();
                resultSet = null;
            }
        }

        @Override
        public void close() throws SQLException {
            try {
                closeResultSet();
            } finally {
                statement.close();
            }
        }

        @Override
        public String toString() {
            return sql;
        }
    }
}
