package com.sentinel.backend.global.error;

import org.springframework.http.HttpStatus;

public record ApiErrorResponse(boolean success, String error, String code, int status, String instance) {

    public static ApiErrorResponse of(HttpStatus httpStatus, String code, String error, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String safeError = (error != null && !error.isBlank()) ? error : httpStatus.getReasonPhrase();
        return new ApiErrorResponse(false, safeError, safeCode, httpStatus.value(), instance);
    }
}
