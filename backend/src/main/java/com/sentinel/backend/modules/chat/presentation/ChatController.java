package com.sentinel.backend.modules.chat.presentation;

import java.time.OffsetDateTime;

import com.sentinel.backend.global.security.SecurityUtils;
import com.sentinel.backend.global.web.ClientIpResolver;
import com.sentinel.backend.modules.chat.application.ChatService;
import com.sentinel.backend.modules.chat.presentation.dto.ChatMessageListResponse;
import com.sentinel.backend.modules.chat.presentation.dto.ChatMessageResponse;
import com.sentinel.backend.modules.chat.presentation.dto.PostMessageRequest;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/chat/messages")
public class ChatController {

    private final ChatService chatService;
    private final ClientIpResolver clientIpResolver;

    public ChatController(ChatService chatService, ClientIpResolver clientIpResolver) {
        this.chatService = chatService;
        this.clientIpResolver = clientIpResolver;
    }

    @Operation(summary = "List room messages", description = "Most recent messages, returned oldest first.")
    @GetMapping
    public ResponseEntity<ChatMessageListResponse> list(
            @RequestParam(name = "room", required = false) String room,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "before", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime before
    ) {
        return ResponseEntity.ok(new ChatMessageListResponse(true, chatService.list(room, limit, before)));
    }

    @Operation(summary = "Post a message")
    @PostMapping
    public ResponseEntity<ChatMessageResponse> post(
            @Valid @RequestBody PostMessageRequest request,
            HttpServletRequest httpRequest
    ) {
        ChatMessageResponse response = chatService.post(request, SecurityUtils.currentPrincipal().orElse(null),
                clientIpResolver.resolve(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Remove a message")
    @DeleteMapping("/{messageId}")
    public ResponseEntity<ChatMessageResponse> delete(@PathVariable("messageId") Long messageId) {
        return ResponseEntity.ok(chatService.delete(messageId));
    }
}
