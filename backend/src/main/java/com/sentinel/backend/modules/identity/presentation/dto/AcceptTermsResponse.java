package com.sentinel.backend.modules.identity.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AcceptTermsResponse(
        boolean success,
        String username,
        @JsonProperty("is_new_user") boolean newUser,
        @JsonProperty("total_visits") int totalVisits
) {
}
