package com.vouch.auth.domain.exception;

/**
 * Base type for every failure raised by the token issuance and verification flows.
 * Each subclass is mapped to a response by GlobalExceptionHandler.
 */
public abstract class TokenLifecycleException extends RuntimeException {

    protected TokenLifecycleException(String message) {
        super(message);
    }

    protected TokenLifecycleException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the caller may retry the same request later.
     */
    public boolean isRetryable() {
        return false;
    }
}
