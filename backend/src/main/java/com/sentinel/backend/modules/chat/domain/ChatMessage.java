package com.sentinel.backend.modules.chat.domain;

import java.time.OffsetDateTime;

import com.sentinel.backend.modules.account.domain.Account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

@Entity
@Table(name = "chat_message")
public class ChatMessage {

    public static final String DEFAULT_ROOM = "geral";
    public static final String DEFAULT_TYPE = "text";
    public static final String REMOVED_PLACEHOLDER = "[Message removed]";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "account_id")
    private Account account;

    @Column(name = "room", nullable = false, length = 50)
    private String room = DEFAULT_ROOM;

    @Column(name = "sender", nullable = false, length = 100)
    private String sender;

    @Column(name = "body", nullable = false, columnDefinition = "text")
    private String body;

    @Column(name = "message_type", nullable = false, length = 20)
    private String type = DEFAULT_TYPE;

    @Column(name = "sent_at", nullable = false)
    private OffsetDateTime sentAt;

    @Column(name = "edited", nullable = false)
    private boolean edited;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Column(name = "reply_to_id")
    private Long replyToId;

    public Long getId() {
        return id;
    }

    public Account getAccount() {
        return account;
    }

    public void setAccount(Account account) {
        this.account = account;
    }

    public String getRoom() {
        return room;
    }

    public void setRoom(String room) {
        this.room = room;
    }

    public String getSender() {
        return sender;
    }

    public void setSender(String sender) {
        this.sender = sender;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public OffsetDateTime getSentAt() {
        return sentAt;
    }

    public void setSentAt(OffsetDateTime sentAt) {
        this.sentAt = sentAt;
    }

    public boolean isEdited() {
        return edited;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public void markDeleted() {
        this.deleted = true;
    }

    public Long getReplyToId() {
        return replyToId;
    }

    public void setReplyToId(Long replyToId) {
        this.replyToId = replyToId;
    }

    public String visibleBody() {
        return deleted ? REMOVED_PLACEHOLDER : body;
    }
}
