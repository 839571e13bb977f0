package com.vouch.auth.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time token counts for monitoring.
 */
public class TokenStats {

    private final Map<FlowType, Long> activeByType;
    private final long expired;
    private final Instant generatedAt;

    public TokenStats(Map<FlowType, Long> activeByType, long expired, Instant generatedAt) {
        EnumMap<FlowType, Long> counts = new EnumMap<>(FlowType.class);
        for (FlowType type : FlowType.values()) {
            counts.put(type, activeByType.getOrDefault(type, 0L));
        }
        this.activeByType = Collections.unmodifiableMap(counts);
        this.expired = expired;
        this.generatedAt = generatedAt;
    }

    public Map<FlowType, Long> getActiveByType() {
        return activeByType;
    }

    public long getActive(FlowType type) {
        return activeByType.get(type);
    }

    public long getExpired() {
        return expired;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }
}
