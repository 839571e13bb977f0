package com.vouch.auth.domain.model;

/**
 * How issuance frequency is counted.
 * STORE_WINDOW counts persisted records in the trailing window;
 * REDIS_FIXED_WINDOW keeps a per-hour-bucket counter in Redis.
 */
public enum RateLimitStrategy {
    STORE_WINDOW,
    REDIS_FIXED_WINDOW
}
