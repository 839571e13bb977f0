package com.vouch.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

public class PasswordResetRequestDto {

    // Syntax and domain checks happen in EmailAddressValidator
    @NotBlank(message = "Email is required")
    private String email;

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }
}
