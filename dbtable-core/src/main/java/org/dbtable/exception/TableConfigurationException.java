package org.dbtable.exception;

/**
 * Exception thrown when a table declaration or its use is inconsistent.
 *
 * <p>This covers caller programming errors: a table that declares no columns
 * or no schema, duplicate column names, a row asked for a column its table
 * does not declare, or a primary-key operation on a table that has no
 * primary column. These errors abort the operation immediately.</p>
 */
public class TableConfigurationException extends RuntimeException {

    /**
     * Constructs a new table configuration exception with the specified detail message.
     *
     * @param message The detail message
     */
    public TableConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a new table configuration exception with the specified detail message and cause.
     *
     * @param message The detail message
     * @param cause The cause of the exception
     */
    public TableConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
