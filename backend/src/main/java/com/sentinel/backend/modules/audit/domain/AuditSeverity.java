package com.sentinel.backend.modules.audit.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditSeverity from(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return AuditSeverity.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
