package org.dbtable.exception;

import lombok.Getter;

/**
 * Exception thrown when the connection refuses to prepare a SQL statement.
 *
 * <p>Preparation failures mean the generated or caller-supplied SQL text is
 * wrong, so they are never retried and always abort the calling operation.
 * The driver's exception is kept as the cause.</p>
 */
@Getter
public class StatementPreparationException extends RuntimeException {

    private final String sql;

    /**
     * Constructs a new preparation exception for the given statement text.
     *
     * @param sql The SQL text that could not be prepared
     * @param cause The driver exception
     */
    public StatementPreparationException(String sql, Throwable cause) {
        super("Can't prepare [" + sql + "]: " + cause.getMessage(), cause);
        this.sql = sql;
    }
}
