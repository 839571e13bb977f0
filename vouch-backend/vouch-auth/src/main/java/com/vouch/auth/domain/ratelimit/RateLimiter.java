package com.vouch.auth.domain.ratelimit;

import com.vouch.auth.domain.model.FlowType;

/**
 * Bounds how often one identity may be issued tokens of one flow type.
 */
public interface RateLimiter {

    /**
     * @throws com.vouch.auth.domain.exception.RateLimitExceededException when the identity is over its limit
     * @throws com.vouch.auth.domain.exception.StoreException when the counter cannot be read
     */
    void checkRateLimit(String identity, FlowType flowType);
}
