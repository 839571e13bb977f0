package com.vouch.auth.domain.service;

import com.vouch.auth.config.TokenProperties;
import com.vouch.auth.domain.model.TokenStats;
import com.vouch.auth.domain.store.TokenStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Token Maintenance Service - sweep and monitoring counts
 * Safe to run concurrently with issuance and verification
 */
@Service
@Slf4j
public class TokenMaintenanceService {

    private final TokenStore tokenStore;
    private final TokenProperties properties;
    private final Clock clock;

    public TokenMaintenanceService(TokenStore tokenStore, TokenProperties properties, Clock clock) {
        this.tokenStore = tokenStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Delete expired tokens, and used tokens older than the retention window
     *
     * @return number of deleted records
     */
    public int cleanupExpiredTokens() {
        Instant now = clock.instant();
        Instant usedCutoff = now.minus(properties.getCleanup().getUsedRetention());

        int deleted = tokenStore.deleteExpiredOrStale(now, usedCutoff);
        log.info("[TOKEN_CLEANUP] Expired and stale tokens deleted | deleted={} | usedCutoff={}",
                deleted, usedCutoff);
        return deleted;
    }

    public TokenStats getTokenStats() {
        Instant now = clock.instant();
        TokenStats stats = new TokenStats(tokenStore.countActiveByType(now), tokenStore.countExpired(now), now);
        log.debug("[TOKEN_STATS] Stats computed | active={} | expired={}",
                stats.getActiveByType(), stats.getExpired());
        return stats;
    }
}
