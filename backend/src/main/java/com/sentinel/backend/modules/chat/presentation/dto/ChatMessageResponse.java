package com.sentinel.backend.modules.chat.presentation.dto;

import java.time.OffsetDateTime;

import com.sentinel.backend.modules.chat.domain.ChatMessage;

public record ChatMessageResponse(
        Long id,
        Long accountId,
        String room,
        String sender,
        String message,
        String type,
        OffsetDateTime sentAt,
        boolean edited,
        boolean deleted,
        Long replyTo
) {

    public static ChatMessageResponse from(ChatMessage message) {
        return new ChatMessageResponse(
                message.getId(),
                message.getAccount() != null ? message.getAccount().getId() : null,
                message.getRoom(),
                message.getSender(),
                message.visibleBody(),
                message.getType(),
                message.getSentAt(),
                message.isEdited(),
                message.isDeleted(),
                message.getReplyToId()
        );
    }
}
