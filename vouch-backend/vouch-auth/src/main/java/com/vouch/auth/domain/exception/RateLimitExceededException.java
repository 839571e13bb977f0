package com.vouch.auth.domain.exception;

/**
 * Thrown when an identity has requested too many tokens of one flow type in the window.
 * Mapped to 429 Too Many Requests by GlobalExceptionHandler.
 */
public class RateLimitExceededException extends TokenLifecycleException {

    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, long retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
