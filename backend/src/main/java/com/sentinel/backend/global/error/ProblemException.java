package com.sentinel.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Service-layer failure carrying an HTTP status and a stable machine-readable code.
 * The human-readable message is what reaches the client as {@code error}.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String message;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null);
    }

    public ProblemException(HttpStatus status, String code, String message) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.message = (message != null && !message.isBlank()) ? message : code;
    }

    public static ProblemException notFound(String code, String message) {
        return new ProblemException(HttpStatus.NOT_FOUND, code, message);
    }

    public static ProblemException unauthorized(String code, String message) {
        return new ProblemException(HttpStatus.UNAUTHORIZED, code, message);
    }

    public static ProblemException conflict(String code, String message) {
        return new ProblemException(HttpStatus.CONFLICT, code, message);
    }

    public static ProblemException badRequest(String code, String message) {
        return new ProblemException(HttpStatus.BAD_REQUEST, code, message);
    }

    public String getCode() {
        return code;
    }

    public String getErrorMessage() {
        return message;
    }
}
