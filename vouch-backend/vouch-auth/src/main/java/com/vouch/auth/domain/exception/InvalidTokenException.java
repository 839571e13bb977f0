package com.vouch.auth.domain.exception;

/**
 * Thrown when no matching unused token exists or the supplied secret does not match.
 * Both cases share this type so callers cannot tell them apart.
 * Mapped to 400 Bad Request by GlobalExceptionHandler.
 */
public class InvalidTokenException extends TokenLifecycleException {

    public InvalidTokenException(String message) {
        super(message);
    }
}
