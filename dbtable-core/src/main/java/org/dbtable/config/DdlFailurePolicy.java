package org.dbtable.config;

/**
 * What schema provisioning does when a CREATE, ALTER or GRANT statement fails.
 */
public enum DdlFailurePolicy {
    /**
     * Log the driver error and carry on with the remaining statements.
     * Partial changes are not rolled back.
     */
    BEST_EFFORT,

    /**
     * Abort provisioning by raising a DdlExecutionException.
     */
    FAIL_FAST;

    /**
     * Parse policy from string, case-insensitive.
     * Defaults to BEST_EFFORT if not found.
     */
    public static DdlFailurePolicy fromString(String policy) {
        if (policy == null || policy.trim().isEmpty()) {
            return BEST_EFFORT;
        }

        try {
            return valueOf(policy.toUpperCase().trim().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return BEST_EFFORT;
        }
    }
}
