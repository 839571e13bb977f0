package com.vouch.auth.api.dto;

public class PasswordResetConfirmResponseDto {

    private String userId;
    private String status;      // PASSWORD_RESET

    public PasswordResetConfirmResponseDto(String userId, String status) {
        this.userId = userId;
        this.status = status;
    }

    // Getters
    public String getUserId() {
        return userId;
    }

    public String getStatus() {
        return status;
    }
}
