package org.dbtable.table;

import lombok.extern.slf4j.Slf4j;
import org.dbtable.config.DbTableConfiguration;
import org.dbtable.exception.TableConfigurationException;
import org.dbtable.exception.UnknownTableException;
import org.dbtable.jdbc.DatabaseConnection;
import org.dbtable.sql.TableReferenceResolver;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Owns one database connection and the table gateways that use it.
 *
 * <p>Tables are registered once at setup time and looked up by table name,
 * case-insensitive. The registry also resolves {@code !name!} placeholders
 * in SQL fragments for every registered table.</p>
 *
 * <pre>{@code
 * Database db = new Database(new JdbcDatabaseConnection(connection));
 * EmployeeTable employees = db.register(new EmployeeTable(db));
 * db.ensureSchema();
 * }</pre>
 */
@Slf4j
public class Database implements TableReferenceResolver, AutoCloseable {

    private final DatabaseConnection connection;
    private final DbTableConfiguration configuration;
    private final Map<String, TableGateway<?>> tables = new LinkedHashMap<>();

    /**
     * Creates a database with configuration loaded from the classpath, environment and system properties.
     */
    public Database(DatabaseConnection connection) {
        this(connection, DbTableConfiguration.load());
    }

    public Database(DatabaseConnection connection, DbTableConfiguration configuration) {
        if (connection == null) {
            throw new TableConfigurationException("A database needs a connection");
        }
        this.connection = connection;
        this.configuration = configuration != null ? configuration : DbTableConfiguration.defaults();
    }

    public DatabaseConnection getConnection() {
        return connection;
    }

    public DbTableConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Registers a table under its table name.
     *
     * @return the same table, for assignment
     * @throws TableConfigurationException if the table belongs to another database or the name is taken
     */
    public <T extends TableGateway<?>> T register(T table) {
        if (table.getDatabase() != this) {
            throw new TableConfigurationException(table.fullTableName() + " was created for another database");
        }
        String key = table.tableName().toUpperCase(Locale.ROOT);
        if (tables.containsKey(key)) {
            throw new TableConfigurationException("A table named " + key + " is already registered");
        }
        tables.put(key, table);
        log.debug("Registered table {} as {}", table.fullTableName(), key);
        return table;
    }

    /**
     * @throws UnknownTableException if no table is registered under that name
     */
    public TableGateway<?> getTable(String name) {
        TableGateway<?> table = name == null ? null : tables.get(name.toUpperCase(Locale.ROOT));
        if (table == null) {
            throw new UnknownTableException(name);
        }
        return table;
    }

    /**
     * The registered table of the given type.
     *
     * @throws UnknownTableException if none is registered
     */
    public <T extends TableGateway<?>> T getTable(Class<T> type) {
        for (TableGateway<?> table : tables.values()) {
            if (type.isInstance(table)) {
                return type.cast(table);
            }
        }
        throw new UnknownTableException(type.getSimpleName());
    }

    public List<TableGateway<?>> getTables() {
        return Collections.unmodifiableList(new ArrayList<>(tables.values()));
    }

    @Override
    public String fullTableNameOf(String tableName) {
        return getTable(tableName).fullTableName();
    }

    /**
     * Creates or alters every registered table, in registration order.
     */
    public void ensureSchema() throws SQLException {
        for (TableGateway<?> table : tables.values()) {
            table.ensureSchema();
        }
    }

    public void commit() throws SQLException {
        connection.commit();
    }

    public void rollback() throws SQLException {
        connection.rollback();
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }
}
