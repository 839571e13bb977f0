package com.vouch.auth.domain.exception;

/**
 * Thrown when a token has expired.
 * Mapped to 400 Bad Request by GlobalExceptionHandler, with the same body as InvalidTokenException.
 */
public class TokenExpiredException extends TokenLifecycleException {
    
    public TokenExpiredException(String message) {
        super(message);
    }
}
