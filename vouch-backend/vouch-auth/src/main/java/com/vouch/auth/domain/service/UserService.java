package com.vouch.auth.domain.service;

import com.vouch.auth.domain.constants.TokenConstants;
import com.vouch.auth.domain.exception.StoreException;
import com.vouch.auth.infrastructure.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * User Service - password changes that follow a verified reset code
 */
@Service
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final BCryptPasswordEncoder passwordEncoder;
    private final Clock clock;

    public UserService(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
        this.passwordEncoder = new BCryptPasswordEncoder(TokenConstants.BCRYPT_COST_FACTOR);
    }

    /**
     * Replace the user's password hash
     *
     * @throws StoreException if the user row is missing or the update fails
     */
    @Transactional
    public void updatePassword(UUID userId, String rawPassword) {
        log.info("[PASSWORD_UPDATE_START] Updating password | userId={}", userId);

        String passwordHash = passwordEncoder.encode(rawPassword);
        log.debug("[PASSWORD_HASHED] Password hashed with BCrypt cost={} | userId={}",
                TokenConstants.BCRYPT_COST_FACTOR, userId);

        int updated;
        try {
            updated = userRepository.updatePasswordHash(userId, passwordHash, clock.instant());
        } catch (DataAccessException e) {
            log.error("[PASSWORD_UPDATE_FAILED] Password update failed | userId={} | error={}",
                    userId, e.getMessage(), e);
            throw new StoreException("Failed to update password", e);
        }
        if (updated != 1) {
            log.error("[PASSWORD_UPDATE_FAILED] User row not found | userId={}", userId);
            throw new StoreException("User not found: " + userId);
        }

        log.info("[PASSWORD_UPDATED] Password updated | userId={}", userId);
    }
}
