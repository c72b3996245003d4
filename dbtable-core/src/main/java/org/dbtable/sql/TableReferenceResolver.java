package org.dbtable.sql;

import org.dbtable.exception.UnknownTableException;

/**
 * Resolves a registered table name to its fully qualified {@code SCHEMA.TABLE} name.
 */
@FunctionalInterface
public interface TableReferenceResolver {

    /**
     * @param tableName the name used inside a {@code !name!} placeholder
     * @return the fully qualified name of that table
     * @throws UnknownTableException if no table is registered under that name
     */
    String fullTableNameOf(String tableName);
}
