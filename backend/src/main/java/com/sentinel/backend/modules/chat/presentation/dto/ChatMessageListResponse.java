package com.sentinel.backend.modules.chat.presentation.dto;

import java.util.List;

public record ChatMessageListResponse(boolean success, List<ChatMessageResponse> messages) {
}
