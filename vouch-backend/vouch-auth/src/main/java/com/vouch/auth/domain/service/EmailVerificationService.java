package com.vouch.auth.domain.service;

import com.vouch.auth.api.dto.AcceptedResponseDto;
import com.vouch.auth.api.dto.EmailVerificationRequestDto;
import com.vouch.auth.api.dto.VerifyEmailRequestDto;
import com.vouch.auth.api.dto.VerifyEmailResponseDto;
import com.vouch.auth.domain.model.EmailVerificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Email Verification Service - Handles email verification flow
 * Issues links for signed-in users and consumes them from the public confirm endpoint
 */
@Service
@Slf4j
public class EmailVerificationService {

    private final TokenManager tokenManager;

    public EmailVerificationService(TokenManager tokenManager) {
        this.tokenManager = tokenManager;
    }

    /**
     * Send a verification link to the calling user's account address.
     * A body address, when present, must be that same address.
     */
    public AcceptedResponseDto requestVerification(UUID userId, EmailVerificationRequestDto request,
                                                   String requestIp, String userAgent) {
        tokenManager.requestEmailVerification(userId, request.getEmail(), requestIp, userAgent);
        return new AcceptedResponseDto("Verification email sent.");
    }

    /**
     * Verify email using token from email link
     *
     * @param request Contains verification token
     * @return Response with verified status
     */
    public VerifyEmailResponseDto verifyEmail(VerifyEmailRequestDto request) {
        EmailVerificationResult result = tokenManager.verifyEmailToken(request.getToken());

        if (!result.isNewlyVerified()) {
            log.info("[ALREADY_VERIFIED] Token consumed for an already verified email | userId={}",
                    result.getUserId());
        }

        return new VerifyEmailResponseDto(
                result.getUserId().toString(),
                result.getEmail(),
                "EMAIL_VERIFIED",
                result.getVerifiedAt()
        );
    }
}
