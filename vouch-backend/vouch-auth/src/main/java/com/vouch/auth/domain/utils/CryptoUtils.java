package com.vouch.auth.domain.utils;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import static com.vouch.auth.domain.constants.TokenConstants.HASH_ALGORITHM;

@Component
public class CryptoUtils {

    /**
     * Hash a code or token for storage.
     * SHA-256 is enough here: codes are short-lived and rate-limited, link tokens carry 256 bits.
     *
     * @return 64-char lowercase hex digest
     */
    public String hashSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Secret cannot be null or empty");
        }
        return hashWithSha256Hex(secret);
    }

    /**
     * Constant-time comparison to prevent timing attacks
     */
    public boolean constantTimeEquals(String providedHash, String storedHash) {
        if (providedHash == null || storedHash == null) {
            return false;
        }
        return MessageDigest.isEqual(
            providedHash.getBytes(StandardCharsets.UTF_8),
            storedHash.getBytes(StandardCharsets.UTF_8)
        );
    }

    private String hashWithSha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
