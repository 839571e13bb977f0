package com.vouch.auth.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AccountStatus {
    PENDING_EMAIL_VERIFICATION("PENDING_EMAIL_VERIFICATION"),
    ACTIVE("ACTIVE");

    private final String value;
    AccountStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String toString(){
        return String.valueOf(value);
    }
}
