package com.sentinel.backend.modules.identity.presentation.dto;

import java.util.List;

public record IdentityPageResponse(
        List<IdentitySummaryResponse> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
}
