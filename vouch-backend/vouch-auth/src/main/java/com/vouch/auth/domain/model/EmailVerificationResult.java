package com.vouch.auth.domain.model;

import java.time.Instant;
import java.util.UUID;

public class EmailVerificationResult {

    private final UUID userId;
    private final String email;
    private final boolean newlyVerified;
    private final Instant verifiedAt;

    public EmailVerificationResult(UUID userId, String email, boolean newlyVerified, Instant verifiedAt) {
        this.userId = userId;
        this.email = email;
        this.newlyVerified = newlyVerified;
        this.verifiedAt = verifiedAt;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getEmail() {
        return email;
    }

    /**
     * True only for the call that set the user's verified timestamp.
     */
    public boolean isNewlyVerified() {
        return newlyVerified;
    }

    public Instant getVerifiedAt() {
        return verifiedAt;
    }
}
