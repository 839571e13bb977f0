package com.vouch.auth.infrastructure.repository;

import com.vouch.auth.infrastructure.entity.UserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<UserEntity, UUID> {

    /* ================= READ OPTIMIZATION ================= */

    @Query("""
        select u.id
        from UserEntity u
        where lower(u.email) = :email
    """)
    Optional<UUID> findUserIdByEmail(@Param("email") String email);

    @Query("""
        select u.email
        from UserEntity u
        where u.id = :userId
    """)
    Optional<String> findEmailById(@Param("userId") UUID userId);

    @Query("""
        select u.emailVerifiedAt
        from UserEntity u
        where u.id = :userId
    """)
    Optional<Instant> findEmailVerifiedAtByUserId(@Param("userId") UUID userId);

    /* ================= ACCOUNT STATE ================= */

    /**
     * Set the verified timestamp only if it is still unset and the account address
     * is the one the link was sent to; returns rows updated
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update UserEntity u
           set u.emailVerifiedAt = :verifiedAt, u.updatedAt = :verifiedAt
         where u.id = :userId
           and lower(u.email) = :email
           and u.emailVerifiedAt is null
    """)
    int markEmailVerifiedIfUnset(@Param("userId") UUID userId,
                                 @Param("email") String email,
                                 @Param("verifiedAt") Instant verifiedAt);

    /**
     * Move a user out of one status into another, only if still in the expected one
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update UserEntity u
           set u.status = :newStatus
         where u.id = :userId
           and u.status = :expectedStatus
    """)
    int transitionStatus(@Param("userId") UUID userId,
                         @Param("expectedStatus") String expectedStatus,
                         @Param("newStatus") String newStatus);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update UserEntity u
           set u.passwordHash = :passwordHash, u.updatedAt = :updatedAt
         where u.id = :userId
    """)
    int updatePasswordHash(@Param("userId") UUID userId,
                           @Param("passwordHash") String passwordHash,
                           @Param("updatedAt") Instant updatedAt);
}
