package com.sentinel.backend.modules.chat.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PostMessageRequest(
        @JsonAlias("usuario") @Size(max = 100) String sender,
        @JsonAlias("mensagem") @NotBlank(message = "message is required") @Size(max = 5000) String message,
        @JsonAlias("sala") @Size(max = 50) String room,
        @JsonAlias("tipo") @Size(max = 20) String type,
        @JsonAlias("resposta_para") Long replyTo
) {
}
