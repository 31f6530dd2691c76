package com.sentinel.backend.modules.connection.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RecordConnectionsRequest(
        @JsonAlias("dispositivo_id") Long deviceId,
        @JsonAlias("conexoes") @NotNull @Size(max = 1000) List<@Valid ConnectionEntry> connections
) {
}
