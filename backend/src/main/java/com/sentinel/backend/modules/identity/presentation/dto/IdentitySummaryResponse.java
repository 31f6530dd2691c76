package com.sentinel.backend.modules.identity.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinel.backend.modules.identity.domain.IpIdentity;

public record IdentitySummaryResponse(
        Long id,
        String username,
        String ip,
        @JsonProperty("first_seen") OffsetDateTime firstSeen,
        @JsonProperty("last_seen") OffsetDateTime lastSeen,
        @JsonProperty("total_visits") int totalVisits,
        @JsonProperty("system_info") Map<String, String> systemInfo
) {

    public static IdentitySummaryResponse from(IpIdentity identity) {
        return new IdentitySummaryResponse(
                identity.getId(),
                identity.getUsername(),
                identity.getIpAddress(),
                identity.getFirstSeenAt(),
                identity.getLastSeenAt(),
                identity.getTotalVisits(),
                identity.getMetadata()
        );
    }
}
