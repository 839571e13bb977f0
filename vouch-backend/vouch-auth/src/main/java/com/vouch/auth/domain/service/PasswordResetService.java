package com.vouch.auth.domain.service;

import com.vouch.auth.api.dto.AcceptedResponseDto;
import com.vouch.auth.api.dto.PasswordResetConfirmRequestDto;
import com.vouch.auth.api.dto.PasswordResetConfirmResponseDto;
import com.vouch.auth.api.dto.PasswordResetRequestDto;
import com.vouch.auth.domain.exception.NotifyException;
import com.vouch.auth.domain.exception.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Password Reset Service - public reset flow
 * Request: issue a code without revealing whether the account exists
 * Confirm: consume the code, then store the new password
 */
@Service
@Slf4j
public class PasswordResetService {

    static final String ACCEPTED_MESSAGE =
            "If an account exists for this email, a reset code has been sent.";

    private final TokenManager tokenManager;
    private final UserService userService;

    public PasswordResetService(TokenManager tokenManager, UserService userService) {
        this.tokenManager = tokenManager;
        this.userService = userService;
    }

    /**
     * Rate limiting and delivery failures get the success answer too. The store-window limiter
     * only counts issued codes, so a 429 here would only ever reach existing accounts.
     */
    public AcceptedResponseDto requestReset(PasswordResetRequestDto request, String requestIp, String userAgent) {
        try {
            tokenManager.requestPasswordReset(request.getEmail(), requestIp, userAgent);
        } catch (RateLimitExceededException e) {
            // Nothing issued or sent; the limit still holds
            log.warn("[RESET_RATE_LIMITED] Reset request over limit, answered as accepted | retryAfter={}s",
                    e.getRetryAfterSeconds());
        } catch (NotifyException e) {
            // Same answer as success; the stored code stays valid and can be re-requested
            log.warn("[RESET_DELIVERY_DEFERRED] Reset code stored but not delivered | error={}", e.getMessage());
        }
        return new AcceptedResponseDto(ACCEPTED_MESSAGE);
    }

    /**
     * The code is consumed before the password is written, so a failed write
     * burns the code and the user must request a new one.
     */
    public PasswordResetConfirmResponseDto confirmReset(PasswordResetConfirmRequestDto request) {
        UUID userId = tokenManager.verifyPasswordResetCode(request.getEmail(), request.getCode());
        userService.updatePassword(userId, request.getNewPassword());

        log.info("[RESET_COMPLETE] Password reset completed | userId={}", userId);
        return new PasswordResetConfirmResponseDto(userId.toString(), "PASSWORD_RESET");
    }
}
