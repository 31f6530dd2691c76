package com.sentinel.backend.modules.session.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ValidateResponse(
        boolean success,
        @JsonProperty("valido") boolean valid,
        @JsonProperty("cliente") SessionClientResponse client
) {
}
