package com.vouch.auth.domain.store;

import com.vouch.auth.domain.model.FlowType;
import com.vouch.auth.infrastructure.entity.EmailTokenEntity;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable persistence of token records and the two user-table operations the flows need.
 * Every method throws {@link com.vouch.auth.domain.exception.StoreException} when the
 * underlying store fails.
 */
public interface TokenStore {

    EmailTokenEntity save(EmailTokenEntity token);

    Optional<EmailTokenEntity> findLatestUnused(String email, FlowType type);

    Optional<EmailTokenEntity> findUnusedByHash(String tokenHash, FlowType type);

    /**
     * Atomically flip the record from unused to used.
     *
     * @return true if this call performed the transition, false if the record was
     *         already used (or gone)
     */
    boolean markUsed(Long tokenId, Instant usedAt);

    /**
     * Mark the record used and, in the same transaction, every other unused record
     * of the same email and flow.
     *
     * @return false when the record itself was already used, in which case nothing changes
     */
    boolean markUsedAndRevokeOthers(Long tokenId, String email, FlowType type, Instant usedAt);

    /**
     * Increment the failed-attempt counter of an unused record.
     *
     * @return the counter after the increment, or 0 when the record is no longer unused
     */
    int recordFailedAttempt(Long tokenId);

    /**
     * Delete records expired before {@code now}, and used records created before {@code usedCutoff}.
     *
     * @return number of deleted records
     */
    int deleteExpiredOrStale(Instant now, Instant usedCutoff);

    long countIssuedSince(String email, FlowType type, Instant since);

    Optional<UUID> findUserIdByEmail(String email);

    Optional<String> findUserEmail(UUID userId);

    /**
     * Set the user's email-verified timestamp only when it is not already set and the
     * account's address still equals {@code email}.
     *
     * @return true if this call set it
     */
    boolean markEmailVerifiedIfUnset(UUID userId, String email, Instant verifiedAt);

    Optional<Instant> findEmailVerifiedAt(UUID userId);

    Map<FlowType, Long> countActiveByType(Instant now);

    long countExpired(Instant now);
}
