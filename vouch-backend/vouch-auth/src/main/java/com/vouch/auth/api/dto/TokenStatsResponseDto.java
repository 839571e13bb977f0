package com.vouch.auth.api.dto;

import java.time.Instant;
import java.util.Map;

public class TokenStatsResponseDto {

    private Map<String, Long> activeByType;  // keyed by flow type, e.g. password_reset
    private long expired;
    private Instant generatedAt;

    public TokenStatsResponseDto(Map<String, Long> activeByType, long expired, Instant generatedAt) {
        this.activeByType = activeByType;
        this.expired = expired;
        this.generatedAt = generatedAt;
    }

    // Getters
    public Map<String, Long> getActiveByType() {
        return activeByType;
    }

    public long getExpired() {
        return expired;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }
}
