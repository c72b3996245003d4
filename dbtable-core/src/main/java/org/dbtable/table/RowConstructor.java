package org.dbtable.table;

import java.util.Map;

/**
 * Creates the concrete row type of one table. {@code Row::new} gives the base row type.
 *
 * @param <R> the row type
 */
@FunctionalInterface
public interface RowConstructor<R extends Row> {

    /**
     * @param table the owning table
     * @param values initial column values keyed by upper-case column name
     * @return a row with an empty dirty set
     */
    R create(TableGateway<R> table, Map<String, Object> values);
}
