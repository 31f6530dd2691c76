package com.sentinel.backend.modules.connection.presentation.dto;

import java.util.List;

public record ConnectionPageResponse(
        List<ConnectionResponse> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
}
