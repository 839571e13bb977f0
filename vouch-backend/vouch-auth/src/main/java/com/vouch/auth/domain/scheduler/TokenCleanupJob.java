package com.vouch.auth.domain.scheduler;

import com.vouch.auth.domain.exception.StoreException;
import com.vouch.auth.domain.service.TokenMaintenanceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "vouch.tokens.cleanup", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class TokenCleanupJob {

    private final TokenMaintenanceService maintenanceService;

    public TokenCleanupJob(TokenMaintenanceService maintenanceService) {
        this.maintenanceService = maintenanceService;
    }

    @Scheduled(cron = "${vouch.tokens.cleanup.cron:0 0 2 * * *}")
    public void purgeExpiredTokens() {
        log.info("[CLEANUP_JOB_START] Scheduled token cleanup started");
        try {
            int deleted = maintenanceService.cleanupExpiredTokens();
            log.info("[CLEANUP_JOB_DONE] Scheduled token cleanup finished | deleted={}", deleted);
        } catch (StoreException e) {
            // next run retries; nothing else to do here
            log.error("[CLEANUP_JOB_FAILED] Scheduled token cleanup failed | error={}", e.getMessage(), e);
        }
    }
}
