package com.sentinel.backend.modules.account.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AccessLevel {
    ADMIN,
    MODERATOR,
    USER;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AccessLevel from(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return AccessLevel.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
