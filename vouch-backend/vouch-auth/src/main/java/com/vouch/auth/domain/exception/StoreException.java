package com.vouch.auth.domain.exception;

/**
 * Wraps a persistence failure (database or Redis).
 * Mapped to 503 Service Unavailable by GlobalExceptionHandler.
 */
public class StoreException extends TokenLifecycleException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
