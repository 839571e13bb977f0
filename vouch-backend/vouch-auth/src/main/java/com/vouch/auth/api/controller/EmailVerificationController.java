package com.vouch.auth.api.controller;

import com.vouch.auth.api.dto.AcceptedResponseDto;
import com.vouch.auth.api.dto.EmailVerificationRequestDto;
import com.vouch.auth.api.dto.VerifyEmailRequestDto;
import com.vouch.auth.api.dto.VerifyEmailResponseDto;
import com.vouch.auth.domain.service.EmailVerificationService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Email Verification Controller
 * Issues verification links for signed-in users and confirms them.
 *
 * Endpoints:
 * - POST /auth/email-verification/request
 * - POST /auth/email-verification/confirm
 */
@RestController
@RequestMapping("/auth/email-verification")
@Tag(name = "Email Verification", description = "Email ownership verification links")
public class EmailVerificationController {

    private final EmailVerificationService emailVerificationService;

    public EmailVerificationController(EmailVerificationService emailVerificationService) {
        this.emailVerificationService = emailVerificationService;
    }

    /**
     * Send a verification link to the caller's email
     * Returns 202 Accepted
     */
    @PostMapping("/request")
    public ResponseEntity<AcceptedResponseDto> requestVerification(
            @Valid @RequestBody EmailVerificationRequestDto request,
            Authentication authentication,
            HttpServletRequest httpRequest) {
        UUID userId = UUID.fromString(authentication.getName());
        AcceptedResponseDto response = emailVerificationService.requestVerification(
                userId, request, httpRequest.getRemoteAddr(), httpRequest.getHeader(HttpHeaders.USER_AGENT));

        return ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .body(response);
    }

    /**
     * Verify email with token from email link
     * Returns 200 OK with EMAIL_VERIFIED status
     */
    @PostMapping("/confirm")
    public ResponseEntity<VerifyEmailResponseDto> verifyEmail(
            @Valid @RequestBody VerifyEmailRequestDto request) {
        VerifyEmailResponseDto response = emailVerificationService.verifyEmail(request);
        return ResponseEntity.ok(response);
    }
}
