package com.sentinel.backend.modules.stats.presentation.dto;

import java.time.OffsetDateTime;

public record StatisticsResponse(
        long totalAccounts,
        long accountsActiveLast30Minutes,
        long totalDevices,
        long devicesOnline,
        long totalConnections,
        long messagesToday,
        long activeSessions,
        long ipIdentities,
        OffsetDateTime generatedAt
) {
}
