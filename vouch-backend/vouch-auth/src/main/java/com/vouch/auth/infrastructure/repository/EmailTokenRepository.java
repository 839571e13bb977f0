package com.vouch.auth.infrastructure.repository;

import com.vouch.auth.domain.model.FlowType;
import com.vouch.auth.infrastructure.entity.EmailTokenEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for password-reset and email-verification tokens
 */
public interface EmailTokenRepository extends JpaRepository<EmailTokenEntity, Long> {

    /* ================= LOOKUPS ================= */

    /**
     * Most recently created unused token for an email (password-reset path)
     */
    Optional<EmailTokenEntity> findFirstByEmailAndTypeAndUsedFalseOrderByCreatedAtDescIdDesc(
            String email, FlowType type);

    /**
     * Unused token by its SHA-256 hash (email-verification path)
     */
    Optional<EmailTokenEntity> findFirstByTokenHashAndTypeAndUsedFalse(String tokenHash, FlowType type);

    /* ================= SINGLE-USE TRANSITION ================= */

    /**
     * Flip used=false to used=true. The used=false guard makes this the
     * atomic step: of two concurrent callers only one sees 1 row updated.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update EmailTokenEntity t
           set t.used = true, t.usedAt = :usedAt
         where t.id = :id
           and t.used = false
    """)
    int markUsed(@Param("id") Long id, @Param("usedAt") Instant usedAt);

    /**
     * Retire every outstanding token of one email and flow
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update EmailTokenEntity t
           set t.used = true, t.usedAt = :usedAt
         where t.email = :email
           and t.type = :type
           and t.used = false
    """)
    int revokeUnused(@Param("email") String email, @Param("type") FlowType type, @Param("usedAt") Instant usedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update EmailTokenEntity t
           set t.failedAttempts = t.failedAttempts + 1
         where t.id = :id
           and t.used = false
    """)
    int incrementFailedAttempts(@Param("id") Long id);

    @Query("""
        select t.failedAttempts
        from EmailTokenEntity t
        where t.id = :id
    """)
    Optional<Integer> findFailedAttemptsById(@Param("id") Long id);

    /* ================= RATE LIMIT ================= */

    long countByEmailAndTypeAndCreatedAtAfter(String email, FlowType type, Instant since);

    /* ================= MAINTENANCE ================= */

    /**
     * Delete expired tokens, and used tokens past the audit retention cutoff
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        delete from EmailTokenEntity t
         where t.expiresAt < :now
            or (t.used = true and t.createdAt < :usedCutoff)
    """)
    int deleteExpiredOrStale(@Param("now") Instant now, @Param("usedCutoff") Instant usedCutoff);

    @Query("""
        select t.type as flowType, count(t) as total
        from EmailTokenEntity t
        where t.used = false
          and t.expiresAt > :now
        group by t.type
    """)
    List<FlowTypeCount> countActiveGroupedByType(@Param("now") Instant now);

    long countByExpiresAtLessThanEqual(Instant now);

    interface FlowTypeCount {
        FlowType getFlowType();

        long getTotal();
    }
}
