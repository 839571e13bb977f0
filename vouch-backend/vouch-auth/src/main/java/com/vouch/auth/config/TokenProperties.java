package com.vouch.auth.config;

import com.vouch.auth.domain.model.RateLimitStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "vouch.tokens")
public class TokenProperties {

    private final PasswordReset passwordReset = new PasswordReset();
    private final EmailVerification emailVerification = new EmailVerification();
    private final RateLimit rateLimit = new RateLimit();
    private final Cleanup cleanup = new Cleanup();

    @Data
    public static class PasswordReset {
        private int codeLength = 6;
        private Duration ttl = Duration.ofMinutes(15);
        /** Mismatched codes tolerated before the token is burned. */
        private int maxAttempts = 5;
    }

    @Data
    public static class EmailVerification {
        private Duration ttl = Duration.ofHours(48);
        private String baseUrl = "https://app.vouch.dev/verify";
    }

    @Data
    public static class RateLimit {
        private int maxRequests = 3;
        private Duration window = Duration.ofHours(1);
        private RateLimitStrategy strategy = RateLimitStrategy.STORE_WINDOW;
        /** Run count-check and insert in one serializable transaction. */
        private boolean strict = false;
    }

    @Data
    public static class Cleanup {
        private boolean enabled = true;
        private String cron = "0 0 2 * * *";
        private Duration usedRetention = Duration.ofDays(7);
    }
}
