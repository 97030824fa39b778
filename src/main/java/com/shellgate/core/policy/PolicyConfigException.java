package com.shellgate.core.policy;

/**
 * Raised when a policy document cannot be turned into a {@link PolicySnapshot}.
 * Fatal during startup; downgraded to a warning by {@link PolicyStore#reload}.
 */
public class PolicyConfigException extends RuntimeException {

    public PolicyConfigException(String message) {
        super(message);
    }

    public PolicyConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
