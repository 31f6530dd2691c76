package com.sentinel.backend.modules.chat.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.global.security.SessionPrincipal;
import com.sentinel.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.sentinel.backend.modules.chat.domain.ChatMessage;
import com.sentinel.backend.modules.chat.infrastructure.persistence.ChatMessageRepository;
import com.sentinel.backend.modules.chat.presentation.dto.ChatMessageResponse;
import com.sentinel.backend.modules.chat.presentation.dto.PostMessageRequest;
import com.sentinel.backend.modules.identity.application.IpIdentityService;
import com.sentinel.backend.modules.identity.domain.IpIdentity;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Room-based chat. Senders without an explicit name are shown under their IP identity username.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class ChatService {

    public static final String ANONYMOUS_SENDER = "Anonymous";

    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 500;

    private static final OffsetDateTime LATEST = OffsetDateTime.of(9999, 12, 31, 0, 0, 0, 0, ZoneOffset.UTC);

    private final ChatMessageRepository messageRepository;
    private final AccountRepository accountRepository;
    private final IpIdentityService identityService;
    private final Clock clock;

    public ChatService(
            ChatMessageRepository messageRepository,
            AccountRepository accountRepository,
            IpIdentityService identityService,
            Clock clock
    ) {
        this.messageRepository = messageRepository;
        this.accountRepository = accountRepository;
        this.identityService = identityService;
        this.clock = clock;
    }

    public ChatMessageResponse post(PostMessageRequest request, SessionPrincipal principal, String ipAddress) {
        if (request.replyTo() != null && !messageRepository.existsById(request.replyTo())) {
            throw messageNotFound();
        }
        ChatMessage message = new ChatMessage();
        message.setBody(request.message().trim());
        message.setRoom(blankToDefault(request.room(), ChatMessage.DEFAULT_ROOM));
        message.setType(blankToDefault(request.type(), ChatMessage.DEFAULT_TYPE));
        message.setSender(resolveSender(request.sender(), ipAddress));
        message.setReplyToId(request.replyTo());
        message.setSentAt(OffsetDateTime.now(clock));
        if (principal != null && principal.accountId() != null) {
            message.setAccount(accountRepository.getReferenceById(principal.accountId()));
        }
        return ChatMessageResponse.from(messageRepository.save(message));
    }

    /**
     * Returns up to {@code limit} of the most recent visible messages before {@code before},
     * oldest first.
     */
    @Transactional(readOnly = true)
    public List<ChatMessageResponse> list(String room, Integer limit, OffsetDateTime before) {
        int safeLimit = (limit == null || limit <= 0) ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        List<ChatMessage> latest = messageRepository.findLatest(
                blankToDefault(room, ChatMessage.DEFAULT_ROOM),
                before != null ? before : LATEST,
                PageRequest.of(0, safeLimit)
        );
        List<ChatMessageResponse> ordered = new ArrayList<>(latest.size());
        for (ChatMessage message : latest) {
            ordered.add(ChatMessageResponse.from(message));
        }
        Collections.reverse(ordered);
        return ordered;
    }

    public ChatMessageResponse delete(Long messageId) {
        ChatMessage message = messageRepository.findById(messageId)
                .orElseThrow(ChatService::messageNotFound);
        message.markDeleted();
        return ChatMessageResponse.from(message);
    }

    @Transactional(readOnly = true)
    public long countSince(OffsetDateTime since) {
        return messageRepository.countBySentAtGreaterThanEqual(since);
    }

    private String resolveSender(String requested, String ipAddress) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        return identityService.get(ipAddress)
                .map(IpIdentity::getUsername)
                .orElse(ANONYMOUS_SENDER);
    }

    private static ProblemException messageNotFound() {
        return ProblemException.notFound("MESSAGE_NOT_FOUND", "Message not found");
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
