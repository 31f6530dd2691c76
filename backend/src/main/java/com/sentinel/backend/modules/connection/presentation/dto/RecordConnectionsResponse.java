package com.sentinel.backend.modules.connection.presentation.dto;

public record RecordConnectionsResponse(boolean success, int recorded) {
}
