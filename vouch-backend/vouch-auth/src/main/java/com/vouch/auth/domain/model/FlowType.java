package com.vouch.auth.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which credential flow a token record belongs to.
 */
public enum FlowType {
    PASSWORD_RESET("password_reset"),
    EMAIL_VERIFICATION("email_verification"),
    MAGIC_LINK("magic_link");

    private final String value;

    FlowType(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String toString() {
        return value;
    }
}
