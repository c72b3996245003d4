package org.dbtable.jdbc;

import java.sql.SQLException;

/**
 * A statement prepared by a {@link DatabaseConnection}, ready to be executed with bind values.
 */
public interface PreparedSql extends AutoCloseable {

    /**
     * The SQL text this statement was prepared from.
     */
    String getSql();

    @Override
    void close() throws SQLException;
}
