package com.vouch.auth.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class VerifyEmailRequestDto {

    @NotBlank(message = "Verification token is required")
    @Size(max = 128, message = "Verification token is too long")
    private String token;

    // Getters and setters
    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }
}
