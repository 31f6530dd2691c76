package com.sentinel.backend.modules.session.presentation.dto;

public record SuccessResponse(boolean success) {

    public static SuccessResponse ok() {
        return new SuccessResponse(true);
    }
}
