package com.sentinel.backend.modules.identity.domain;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import com.sentinel.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Pseudonymous identity bound to one client IP address. Rows are created through
 * {@code IpIdentityRepository#insertIfAbsent} so that concurrent first contacts converge on one row.
 */
@Entity
@Table(name = "ip_identity")
public class IpIdentity extends AbstractTimestampedEntity {

    public static final String USER_AGENT_KEY = "user_agent";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "ip_address", nullable = false, unique = true, length = 64, updatable = false)
    private String ipAddress;

    @Column(name = "username", nullable = false, unique = true, length = 64)
    private String username;

    @Column(name = "first_seen_at", nullable = false, updatable = false)
    private OffsetDateTime firstSeenAt;

    @Column(name = "last_seen_at", nullable = false)
    private OffsetDateTime lastSeenAt;

    @Column(name = "total_visits", nullable = false)
    private int totalVisits;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", nullable = false, columnDefinition = "jsonb")
    private Map<String, String> metadata = new LinkedHashMap<>();

    public Long getId() {
        return id;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUsername() {
        return username;
    }

    public OffsetDateTime getFirstSeenAt() {
        return firstSeenAt;
    }

    public OffsetDateTime getLastSeenAt() {
        return lastSeenAt;
    }

    public int getTotalVisits() {
        return totalVisits;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * Counts one visit. Metadata is merged key by key; incoming values win.
     */
    public void recordVisit(OffsetDateTime seenAt, String userAgent, Map<String, String> incoming) {
        this.totalVisits++;
        if (lastSeenAt == null || seenAt.isAfter(lastSeenAt)) {
            this.lastSeenAt = seenAt;
        }
        Map<String, String> merged = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        if (incoming != null) {
            incoming.forEach((key, value) -> {
                if (key != null && value != null) {
                    merged.put(key, value);
                }
            });
        }
        if (userAgent != null && !userAgent.isBlank()) {
            merged.put(USER_AGENT_KEY, userAgent);
        }
        this.metadata = merged;
    }
}
