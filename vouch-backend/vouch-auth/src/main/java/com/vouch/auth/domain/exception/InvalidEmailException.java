package com.vouch.auth.domain.exception;

/**
 * Thrown when an email address is malformed, points at a non-routable domain,
 * or is not the signed-in account's own address.
 * Mapped to 400 Bad Request by GlobalExceptionHandler.
 */
public class InvalidEmailException extends TokenLifecycleException {

    public InvalidEmailException(String message) {
        super(message);
    }
}
