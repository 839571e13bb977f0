package com.vouch.auth.infrastructure.store;

import com.vouch.auth.domain.exception.StoreException;
import com.vouch.auth.domain.model.AccountStatus;
import com.vouch.auth.domain.model.FlowType;
import com.vouch.auth.domain.store.TokenStore;
import com.vouch.auth.infrastructure.entity.EmailTokenEntity;
import com.vouch.auth.infrastructure.repository.EmailTokenRepository;
import com.vouch.auth.infrastructure.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * TokenStore backed by Spring Data JPA.
 * Translates DataAccessException into StoreException so callers see one error type.
 */
@Component
@Slf4j
public class JpaTokenStore implements TokenStore {

    private final EmailTokenRepository tokenRepository;
    private final UserRepository userRepository;

    public JpaTokenStore(EmailTokenRepository tokenRepository, UserRepository userRepository) {
        this.tokenRepository = tokenRepository;
        this.userRepository = userRepository;
    }

    @Override
    @Transactional
    public EmailTokenEntity save(EmailTokenEntity token) {
        return access("save token", () -> tokenRepository.save(token));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<EmailTokenEntity> findLatestUnused(String email, FlowType type) {
        return access("find latest unused token", () ->
                tokenRepository.findFirstByEmailAndTypeAndUsedFalseOrderByCreatedAtDescIdDesc(email, type));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<EmailTokenEntity> findUnusedByHash(String tokenHash, FlowType type) {
        return access("find token by hash", () ->
                tokenRepository.findFirstByTokenHashAndTypeAndUsedFalse(tokenHash, type));
    }

    @Override
    @Transactional
    public boolean markUsed(Long tokenId, Instant usedAt) {
        int updated = access("mark token used", () -> tokenRepository.markUsed(tokenId, usedAt));
        log.debug("[TOKEN_MARK_USED] Conditional update applied | tokenId={} | rows={}", tokenId, updated);
        return updated == 1;
    }

    @Override
    @Transactional
    public boolean markUsedAndRevokeOthers(Long tokenId, String email, FlowType type, Instant usedAt) {
        return access("consume token", () -> {
            if (tokenRepository.markUsed(tokenId, usedAt) == 0) {
                return false;
            }
            int revoked = tokenRepository.revokeUnused(email, type, usedAt);
            log.debug("[TOKEN_SIBLINGS_REVOKED] Outstanding tokens revoked | tokenId={} | type={} | rows={}",
                    tokenId, type, revoked);
            return true;
        });
    }

    @Override
    @Transactional
    public int recordFailedAttempt(Long tokenId) {
        return access("record failed attempt", () -> {
            if (tokenRepository.incrementFailedAttempts(tokenId) == 0) {
                return 0;
            }
            return tokenRepository.findFailedAttemptsById(tokenId).orElse(0);
        });
    }

    @Override
    @Transactional
    public int deleteExpiredOrStale(Instant now, Instant usedCutoff) {
        return access("delete expired tokens", () -> tokenRepository.deleteExpiredOrStale(now, usedCutoff));
    }

    @Override
    @Transactional(readOnly = true)
    public long countIssuedSince(String email, FlowType type, Instant since) {
        return access("count issued tokens", () ->
                tokenRepository.countByEmailAndTypeAndCreatedAtAfter(email, type, since));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UUID> findUserIdByEmail(String email) {
        return access("resolve user by email", () -> userRepository.findUserIdByEmail(email));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findUserEmail(UUID userId) {
        return access("read user email", () -> userRepository.findEmailById(userId));
    }

    @Override
    @Transactional
    public boolean markEmailVerifiedIfUnset(UUID userId, String email, Instant verifiedAt) {
        return access("mark email verified", () -> {
            if (userRepository.markEmailVerifiedIfUnset(userId, email, verifiedAt) == 0) {
                return false;
            }
            userRepository.transitionStatus(userId,
                    AccountStatus.PENDING_EMAIL_VERIFICATION.toString(), AccountStatus.ACTIVE.toString());
            return true;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Instant> findEmailVerifiedAt(UUID userId) {
        return access("read email verified timestamp", () -> userRepository.findEmailVerifiedAtByUserId(userId));
    }

    @Override
    @Transactional(readOnly = true)
    public Map<FlowType, Long> countActiveByType(Instant now) {
        return access("count active tokens", () -> {
            Map<FlowType, Long> counts = new EnumMap<>(FlowType.class);
            for (EmailTokenRepository.FlowTypeCount row : tokenRepository.countActiveGroupedByType(now)) {
                counts.put(row.getFlowType(), row.getTotal());
            }
            return counts;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public long countExpired(Instant now) {
        return access("count expired tokens", () -> tokenRepository.countByExpiresAtLessThanEqual(now));
    }

    private <T> T access(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("[STORE_ERROR] Token store operation failed | operation={} | error={}",
                    operation, e.getMessage(), e);
            throw new StoreException("Token store failed to " + operation, e);
        }
    }
}
