package com.sentinel.backend.modules.identity.presentation.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code accept_terms} may be omitted; an explicit {@code false} is rejected.
 */
public record AcceptTermsRequest(
        @JsonProperty("accept_terms") Boolean acceptTerms,
        @JsonProperty("system_info") Map<String, Object> systemInfo
) {
}
