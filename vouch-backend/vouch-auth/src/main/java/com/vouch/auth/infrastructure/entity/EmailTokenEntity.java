package com.vouch.auth.infrastructure.entity;

import com.vouch.auth.domain.model.FlowType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

import static com.vouch.auth.domain.constants.TokenConstants.HASH_HEX_LENGTH;
import static com.vouch.auth.domain.constants.TokenConstants.MAX_REQUEST_IP_LENGTH;
import static com.vouch.auth.domain.constants.TokenConstants.MAX_USER_AGENT_LENGTH;

/**
 * Email Token Entity
 * Stores SHA-256 hash of a reset code or verification token (never the raw value)
 * Raw value goes to the user, hash stays here
 */
@Entity
@Table(name = "email_tokens", indexes = {
        @Index(name = "idx_email_tokens_email_type", columnList = "email, type"),
        @Index(name = "idx_email_tokens_token_hash", columnList = "token_hash"),
        @Index(name = "idx_email_tokens_expires_at", columnList = "expires_at"),
        @Index(name = "idx_email_tokens_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmailTokenEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * SHA-256 hash (hex) of the raw code or token
     */
    @Column(name = "token_hash", nullable = false, length = HASH_HEX_LENGTH)
    private String tokenHash;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(nullable = false)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private FlowType type;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(nullable = false)
    private boolean used;

    @Column(name = "used_at")
    private Instant usedAt;

    @Column(name = "failed_attempts", nullable = false)
    private int failedAttempts;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "request_ip", length = MAX_REQUEST_IP_LENGTH)
    private String requestIp;

    @Column(name = "user_agent", length = MAX_USER_AGENT_LENGTH)
    private String userAgent;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            throw new IllegalStateException("Token creation time must be set from the service clock");
        }
        if (expiresAt == null || !expiresAt.isAfter(createdAt)) {
            throw new IllegalStateException("Token expiry must be later than its creation time");
        }
    }
}
