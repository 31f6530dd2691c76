package com.sentinel.backend.modules.session.domain;

import java.time.OffsetDateTime;

import com.sentinel.backend.global.jpa.AbstractTimestampedEntity;
import com.sentinel.backend.modules.account.domain.Account;
import com.sentinel.backend.modules.identity.domain.IpIdentity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Token-authenticated login grant. Either {@code account} is set (credential login) or
 * {@code ipIdentity} is set (accept-terms flow). Once {@code active} is false the session never
 * becomes active again.
 */
@Entity
@Table(name = "client_session")
public class ClientSession extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "account_id")
    private Account account;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "ip_identity_id")
    private IpIdentity ipIdentity;

    @Column(name = "token_hash", nullable = false, unique = true, length = 64)
    private String tokenHash;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent")
    private String userAgent;

    @Column(name = "issued_at", nullable = false)
    private OffsetDateTime issuedAt;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "last_activity_at", nullable = false)
    private OffsetDateTime lastActivityAt;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    @Column(name = "revoked_reason", length = 32)
    private String revokedReason;

    public Long getId() {
        return id;
    }

    public Account getAccount() {
        return account;
    }

    public void setAccount(Account account) {
        this.account = account;
    }

    public IpIdentity getIpIdentity() {
        return ipIdentity;
    }

    public void setIpIdentity(IpIdentity ipIdentity) {
        this.ipIdentity = ipIdentity;
    }

    public String getTokenHash() {
        return tokenHash;
    }

    public void setTokenHash(String tokenHash) {
        this.tokenHash = tokenHash;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public void setIpAddress(String ipAddress) {
        this.ipAddress = ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public OffsetDateTime getIssuedAt() {
        return issuedAt;
    }

    public void setIssuedAt(OffsetDateTime issuedAt) {
        this.issuedAt = issuedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(OffsetDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    public OffsetDateTime getLastActivityAt() {
        return lastActivityAt;
    }

    public void setLastActivityAt(OffsetDateTime lastActivityAt) {
        this.lastActivityAt = lastActivityAt;
    }

    public boolean isActive() {
        return active;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public String getRevokedReason() {
        return revokedReason;
    }

    /**
     * Expired means the expiry instant is not after {@code now}; a zero TTL is expired immediately.
     */
    public boolean isExpiredAt(OffsetDateTime now) {
        return !expiresAt.isAfter(now);
    }

    /**
     * Terminal transition. Returns false when the session was already inactive.
     */
    public boolean deactivate(OffsetDateTime at, String reason) {
        if (!active) {
            return false;
        }
        this.active = false;
        this.revokedAt = at;
        this.revokedReason = reason;
        return true;
    }

    public String displayName() {
        if (account != null) {
            return account.getName();
        }
        return ipIdentity != null ? ipIdentity.getUsername() : null;
    }
}
