package com.sentinel.backend.modules.device.presentation.dto;

import java.util.List;

public record DevicePageResponse(
        List<DeviceResponse> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
}
