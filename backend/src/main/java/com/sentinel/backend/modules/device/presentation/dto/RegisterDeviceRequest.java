package com.sentinel.backend.modules.device.presentation.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;

public record RegisterDeviceRequest(
        @JsonProperty("system_info") @NotNull(message = "system_info is required") Map<String, Object> systemInfo
) {
}
