package org.dbtable.exception;

import lombok.Getter;

/**
 * Thrown when a table is looked up by a name the owning database never registered,
 * typically from a {@code !name!} placeholder in a SQL fragment.
 */
@Getter
public class UnknownTableException extends TableConfigurationException {

    private final String tableName;

    public UnknownTableException(String tableName) {
        super("No table named '" + tableName + "' is registered with this database");
        this.tableName = tableName;
    }
}
