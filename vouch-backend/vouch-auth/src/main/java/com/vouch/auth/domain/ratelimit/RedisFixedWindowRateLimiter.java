package com.vouch.auth.domain.ratelimit;

import com.vouch.auth.config.TokenProperties;
import com.vouch.auth.domain.exception.RateLimitExceededException;
import com.vouch.auth.domain.exception.StoreException;
import com.vouch.auth.domain.model.FlowType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

import static com.vouch.auth.domain.constants.TokenConstants.REDIS_RATE_LIMIT_PREFIX;

/**
 * Fixed-window counter in Redis keyed by identity, flow and window bucket.
 * O(1) per check, at the cost of allowing up to twice the limit across a bucket boundary.
 * Every check counts, including requests for emails with no account.
 */
@Component
@ConditionalOnProperty(prefix = "vouch.tokens.rate-limit", name = "strategy",
        havingValue = "REDIS_FIXED_WINDOW")
@Slf4j
public class RedisFixedWindowRateLimiter implements RateLimiter {

    private final StringRedisTemplate redisTemplate;
    private final TokenProperties properties;
    private final Clock clock;

    public RedisFixedWindowRateLimiter(StringRedisTemplate redisTemplate, TokenProperties properties, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void checkRateLimit(String identity, FlowType flowType) {
        Duration window = properties.getRateLimit().getWindow();
        int maxRequests = properties.getRateLimit().getMaxRequests();
        long windowSeconds = window.toSeconds();
        long nowSeconds = clock.instant().getEpochSecond();
        long bucket = nowSeconds / windowSeconds;

        String key = REDIS_RATE_LIMIT_PREFIX + flowType.name() + ":" + identity + ":" + bucket;
        Long count;
        try {
            count = redisTemplate.opsForValue().increment(key);
            if (count != null && count == 1L) {
                redisTemplate.expire(key, window);
            }
        } catch (DataAccessException e) {
            log.error("[RATE_LIMIT_STORE_ERROR] Redis counter unavailable | identity={} | flow={} | error={}",
                    identity, flowType, e.getMessage(), e);
            throw new StoreException("Rate limit counter unavailable", e);
        }

        if (count != null && count > maxRequests) {
            long retryAfter = (bucket + 1) * windowSeconds - nowSeconds;
            log.warn("[RATE_LIMIT] Too many token requests | identity={} | flow={} | count={} | max={} | retryAfter={}s",
                    identity, flowType, count, maxRequests, retryAfter);
            throw new RateLimitExceededException("Too many requests. Please try again later.", retryAfter);
        }
    }
}
