package com.sentinel.backend.modules.connection.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * One reported connection. Field aliases accept the agent's original key names.
 */
public record ConnectionEntry(
        @JsonAlias("ip_local") @Size(max = 64) String localIp,
        @JsonAlias("ip_remoto") @Size(max = 64) String remoteIp,
        @JsonAlias("porta_local") @Min(0) @Max(65535) Integer localPort,
        @JsonAlias("porta_remota") @Min(0) @Max(65535) Integer remotePort,
        @JsonAlias("type") @Size(max = 10) String protocol,
        @Size(max = 20) String status,
        @JsonAlias({"processo", "name"}) @Size(max = 100) String process,
        Integer pid,
        @Min(0) Integer durationSeconds,
        @Min(0) Long bytesSent,
        @Min(0) Long bytesReceived
) {
}
