package com.vouch.auth.api.dto;

public class CleanupResponseDto {

    private int deleted;

    public CleanupResponseDto(int deleted) {
        this.deleted = deleted;
    }

    public int getDeleted() {
        return deleted;
    }
}
