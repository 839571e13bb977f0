package com.vouch.auth.api.dto;

/**
 * Body of every 202 response. The message never reveals whether an account exists.
 */
public class AcceptedResponseDto {

    private String message;

    public AcceptedResponseDto(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
