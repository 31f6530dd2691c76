package com.sentinel.backend.modules.session.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        @NotBlank(message = "email is required") String email,
        @JsonProperty("senha") @JsonAlias("password") @NotBlank(message = "senha is required") String password
) {
}
