package org.dbtable.exception;

/**
 * Thrown when a table is asked to save or delete a row that belongs to another table.
 */
public class RowTypeMismatchException extends TableConfigurationException {

    public RowTypeMismatchException(String message) {
        super(message);
    }
}
