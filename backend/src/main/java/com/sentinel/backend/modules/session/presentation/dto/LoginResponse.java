package com.sentinel.backend.modules.session.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinel.backend.modules.account.presentation.dto.AccountResponse;

public record LoginResponse(
        boolean success,
        String token,
        @JsonProperty("cliente") AccountResponse client
) {
}
