package org.dbtable.jdbc;

import lombok.Data;

import java.sql.SQLException;

/**
 * The driver's report of a failed statement execution: error code, SQL state and message.
 */
@Data
public class ExecutionError {
    private final int code;
    private final String state;
    private final String message;
    private final String sql;

    /**
     * Creates an execution error.
     *
     * @param code vendor error code
     * @param state SQLSTATE, may be null
     * @param message driver message
     * @param sql the statement that failed
     */
    public ExecutionError(int code, String state, String message, String sql) {
        this.code = code;
        this.state = state;
        this.message = message;
        this.sql = sql;
    }

    public static ExecutionError from(SQLException e, String sql) {
        return new ExecutionError(e.getErrorCode(), e.getSQLState(), e.getMessage(), sql);
    }

    /**
     * {@code code[state] : message}
     */
    public String describe() {
        return code + "[" + state + "] : " + message;
    }
}
