package com.vouch.auth.domain.exception;

/**
 * Thrown when a secret cannot be generated, either because of a bad parameter
 * or because the random source failed. Never retried.
 * Mapped to 500 Internal Server Error by GlobalExceptionHandler.
 */
public class GenerationException extends TokenLifecycleException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
