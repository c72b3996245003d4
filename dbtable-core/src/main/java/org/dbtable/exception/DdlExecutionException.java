package org.dbtable.exception;

import lombok.Getter;

/**
 * Raised for a failed CREATE, ALTER or GRANT statement when the DDL failure
 * policy is {@code FAIL_FAST}. Under the default best-effort policy the same
 * failures are only logged.
 */
@Getter
public class DdlExecutionException extends RuntimeException {

    private final String sql;

    public DdlExecutionException(String sql, Throwable cause) {
        super("DDL statement failed [" + sql + "]: " + cause.getMessage(), cause);
        this.sql = sql;
    }
}
