package com.vouch.auth.domain.exception;

/**
 * Thrown when a code or link could not be handed to the delivery channel.
 * The token that was already persisted stays valid.
 */
public class NotifyException extends TokenLifecycleException {

    public NotifyException(String message) {
        super(message);
    }

    public NotifyException(String message, Throwable cause) {
        super(message, cause);
    }
}
