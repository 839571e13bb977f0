package com.vouch.auth.api.controller;

import com.vouch.auth.api.dto.CleanupResponseDto;
import com.vouch.auth.api.dto.TokenStatsResponseDto;
import com.vouch.auth.domain.model.TokenStats;
import com.vouch.auth.domain.service.TokenMaintenanceService;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token Admin Controller - operator endpoints, ADMIN role only
 */
@RestController
@RequestMapping("/internal/tokens")
@Tag(name = "Token Maintenance", description = "Token statistics and manual cleanup")
public class TokenAdminController {

    private final TokenMaintenanceService maintenanceService;

    public TokenAdminController(TokenMaintenanceService maintenanceService) {
        this.maintenanceService = maintenanceService;
    }

    @GetMapping("/stats")
    public ResponseEntity<TokenStatsResponseDto> stats() {
        TokenStats stats = maintenanceService.getTokenStats();

        Map<String, Long> activeByType = new LinkedHashMap<>();
        stats.getActiveByType().forEach((type, count) -> activeByType.put(type.toString(), count));

        return ResponseEntity.ok(new TokenStatsResponseDto(activeByType, stats.getExpired(), stats.getGeneratedAt()));
    }

    @PostMapping("/cleanup")
    public ResponseEntity<CleanupResponseDto> cleanup() {
        return ResponseEntity.ok(new CleanupResponseDto(maintenanceService.cleanupExpiredTokens()));
    }
}
