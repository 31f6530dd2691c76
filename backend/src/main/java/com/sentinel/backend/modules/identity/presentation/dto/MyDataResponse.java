package com.sentinel.backend.modules.identity.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinel.backend.modules.identity.domain.IpIdentity;

public record MyDataResponse(boolean success, IdentityData data) {

    public static MyDataResponse of(IpIdentity identity) {
        return new MyDataResponse(true, new IdentityData(
                identity.getUsername(),
                identity.getIpAddress(),
                identity.getFirstSeenAt(),
                identity.getLastSeenAt(),
                identity.getTotalVisits(),
                identity.getMetadata()
        ));
    }

    public record IdentityData(
            String username,
            String ip,
            @JsonProperty("created_at") OffsetDateTime createdAt,
            @JsonProperty("last_seen") OffsetDateTime lastSeen,
            @JsonProperty("total_visits") int totalVisits,
            @JsonProperty("system_info") Map<String, String> systemInfo
    ) {
    }
}
