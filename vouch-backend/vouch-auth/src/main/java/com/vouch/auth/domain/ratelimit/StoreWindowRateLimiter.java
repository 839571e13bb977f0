package com.vouch.auth.domain.ratelimit;

import com.vouch.auth.config.TokenProperties;
import com.vouch.auth.domain.exception.RateLimitExceededException;
import com.vouch.auth.domain.model.FlowType;
import com.vouch.auth.domain.store.TokenStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Sliding-window limiter over persisted issuance history.
 * Counting stored records keeps every service instance in agreement; the count
 * grows through the insert that follows a successful check, not here.
 */
@Component
@ConditionalOnProperty(prefix = "vouch.tokens.rate-limit", name = "strategy",
        havingValue = "STORE_WINDOW", matchIfMissing = true)
@Slf4j
public class StoreWindowRateLimiter implements RateLimiter {

    private final TokenStore tokenStore;
    private final TokenProperties properties;
    private final Clock clock;

    public StoreWindowRateLimiter(TokenStore tokenStore, TokenProperties properties, Clock clock) {
        this.tokenStore = tokenStore;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void checkRateLimit(String identity, FlowType flowType) {
        Duration window = properties.getRateLimit().getWindow();
        int maxRequests = properties.getRateLimit().getMaxRequests();
        Instant since = clock.instant().minus(window);

        long issued = tokenStore.countIssuedSince(identity, flowType, since);
        if (issued >= maxRequests) {
            log.warn("[RATE_LIMIT] Too many token requests | identity={} | flow={} | issued={} | max={}",
                    identity, flowType, issued, maxRequests);
            throw new RateLimitExceededException("Too many requests. Please try again later.",
                    window.toSeconds());
        }
        log.debug("[RATE_LIMIT_OK] Within limit | identity={} | flow={} | issued={}/{}",
                identity, flowType, issued, maxRequests);
    }
}
