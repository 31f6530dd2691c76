package com.sentinel.backend.modules.session.presentation.dto;

public record LogoutRequest(String token) {
}
