package com.vouch.auth.domain.model;

public enum EventType {
    PASSWORD_RESET_CODE_REQUESTED("PASSWORD_RESET_CODE_REQUESTED"),
    EMAIL_VERIFICATION_REQUESTED("EMAIL_VERIFICATION_REQUESTED");

    private final String value;

    EventType(String value){
        this.value = value;
    }

    @Override
    public String toString(){
        return String.valueOf(value);
    }
}
