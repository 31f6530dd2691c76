package com.sentinel.backend.modules.identity.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinel.backend.modules.identity.domain.IpIdentity;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserInfoResponse(
        boolean exists,
        String username,
        String ip,
        @JsonProperty("total_visits") Integer totalVisits,
        @JsonProperty("first_visit") OffsetDateTime firstVisit,
        @JsonProperty("last_seen") OffsetDateTime lastSeen
) {

    public static UserInfoResponse of(IpIdentity identity, String ip) {
        return new UserInfoResponse(true, identity.getUsername(), ip, identity.getTotalVisits(),
                identity.getFirstSeenAt(), identity.getLastSeenAt());
    }

    public static UserInfoResponse unknown(String ip) {
        return new UserInfoResponse(false, null, ip, null, null, null);
    }
}
