package com.vouch.auth.domain.service;

import com.vouch.auth.domain.exception.GenerationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

import static com.vouch.auth.domain.constants.TokenConstants.MAX_CODE_LENGTH;
import static com.vouch.auth.domain.constants.TokenConstants.MIN_CODE_LENGTH;
import static com.vouch.auth.domain.constants.TokenConstants.TOKEN_BYTE_LENGTH;

/**
 * Secret Generator - numeric codes and opaque link tokens
 * Both draw from the injected SecureRandom, never a time-seeded source
 */
@Component
@Slf4j
public class SecretGenerator {

    private static final long[] POWERS_OF_TEN = new long[MAX_CODE_LENGTH + 1];

    static {
        POWERS_OF_TEN[0] = 1L;
        for (int i = 1; i <= MAX_CODE_LENGTH; i++) {
            POWERS_OF_TEN[i] = POWERS_OF_TEN[i - 1] * 10L;
        }
    }

    private final SecureRandom secureRandom;

    public SecretGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /**
     * Generate a zero-padded code of exactly {@code length} digits,
     * uniform over [0, 10^length)
     */
    public String generateNumericCode(int length) {
        if (length < MIN_CODE_LENGTH || length > MAX_CODE_LENGTH) {
            throw new GenerationException("Code length must be between " + MIN_CODE_LENGTH
                    + " and " + MAX_CODE_LENGTH + ", got " + length);
        }
        try {
            long value = secureRandom.nextLong(POWERS_OF_TEN[length]);
            return String.format("%0" + length + "d", value);
        } catch (RuntimeException e) {
            log.error("[CODE_GENERATION_FAILED] Random source failure | length={}", length, e);
            throw new GenerationException("Failed to generate numeric code", e);
        }
    }

    /**
     * Generate cryptographically secure 256-bit random token
     * Returns Base64-encoded string for URL safety
     */
    public String generateOpaqueToken() {
        byte[] randomBytes = new byte[TOKEN_BYTE_LENGTH];
        try {
            secureRandom.nextBytes(randomBytes);
        } catch (RuntimeException e) {
            log.error("[TOKEN_GENERATION_FAILED] Random source failure", e);
            throw new GenerationException("Failed to generate opaque token", e);
        }
        String rawToken = Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);

        log.debug("[TOKEN_GENERATED] Raw token generated | length={} bits", randomBytes.length * 8);
        return rawToken;
    }
}
