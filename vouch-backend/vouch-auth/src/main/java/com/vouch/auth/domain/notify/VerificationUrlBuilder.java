package com.vouch.auth.domain.notify;

/**
 * Builds the externally reachable URL a user opens to verify their email.
 */
public interface VerificationUrlBuilder {

    String buildVerificationUrl(String rawToken);
}
