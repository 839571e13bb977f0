package com.vouch.auth.api.controller;

import com.vouch.auth.api.dto.AcceptedResponseDto;
import com.vouch.auth.api.dto.PasswordResetConfirmRequestDto;
import com.vouch.auth.api.dto.PasswordResetConfirmResponseDto;
import com.vouch.auth.api.dto.PasswordResetRequestDto;
import com.vouch.auth.domain.service.PasswordResetService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Password Reset Controller
 *
 * Endpoints:
 * - POST /auth/password-reset/request
 * - POST /auth/password-reset/confirm
 */
@RestController
@RequestMapping("/auth/password-reset")
@Tag(name = "Password Reset", description = "Emailed reset codes")
public class PasswordResetController {

    private final PasswordResetService passwordResetService;

    public PasswordResetController(PasswordResetService passwordResetService) {
        this.passwordResetService = passwordResetService;
    }

    /**
     * Request a reset code
     * Returns 202 Accepted with the same body whether or not the account exists
     */
    @PostMapping("/request")
    public ResponseEntity<AcceptedResponseDto> requestReset(
            @Valid @RequestBody PasswordResetRequestDto request,
            HttpServletRequest httpRequest) {
        AcceptedResponseDto response = passwordResetService.requestReset(
                request, httpRequest.getRemoteAddr(), httpRequest.getHeader(HttpHeaders.USER_AGENT));

        return ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .body(response);
    }

    /**
     * Confirm the code and set a new password
     * Returns 200 OK
     */
    @PostMapping("/confirm")
    public ResponseEntity<PasswordResetConfirmResponseDto> confirmReset(
            @Valid @RequestBody PasswordResetConfirmRequestDto request) {
        PasswordResetConfirmResponseDto response = passwordResetService.confirmReset(request);
        return ResponseEntity.ok(response);
    }
}
