package com.vouch.auth.api.dto;

import jakarta.validation.constraints.Size;

/**
 * Optional confirmation of the address to verify; the link always goes to the account's address
 */
public class EmailVerificationRequestDto {

    @Size(max = 254, message = "Email is too long")
    private String email;

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }
}
