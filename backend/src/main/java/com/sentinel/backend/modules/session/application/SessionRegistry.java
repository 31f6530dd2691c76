package com.sentinel.backend.modules.session.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.modules.account.domain.Account;
import com.sentinel.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.sentinel.backend.modules.identity.domain.IpIdentity;
import com.sentinel.backend.modules.session.domain.ClientSession;
import com.sentinel.backend.modules.session.infrastructure.persistence.ClientSessionRepository;

import org.hibernate.Hibernate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues, validates and revokes session tokens.
 * <p>
 * Validation takes a row lock on the session so that a concurrent revoke and validate serialize:
 * once a revoke has committed, no later validate of the same token succeeds.
 * </p>
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    public static final String REASON_LOGOUT = "LOGOUT";
    public static final String REASON_EXPIRED = "EXPIRED";
    public static final String REASON_ACCOUNT_INACTIVE = "ACCOUNT_INACTIVE";
    public static final String REASON_ACCOUNT_DEACTIVATED = "ACCOUNT_DEACTIVATED";

    private final ClientSessionRepository sessionRepository;
    private final AccountRepository accountRepository;
    private final SessionTokenGenerator tokenGenerator;
    private final SessionProperties properties;
    private final Clock clock;

    public SessionRegistry(
            ClientSessionRepository sessionRepository,
            AccountRepository accountRepository,
            SessionTokenGenerator tokenGenerator,
            SessionProperties properties,
            Clock clock
    ) {
        this.sessionRepository = sessionRepository;
        this.accountRepository = accountRepository;
        this.tokenGenerator = tokenGenerator;
        this.properties = properties;
        this.clock = clock;
    }

    public IssuedSession createSession(Long accountId, String ipAddress, String userAgent, Duration ttl) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> ProblemException.notFound("ACCOUNT_NOT_FOUND", "Account not found"));
        if (!account.isActive()) {
            throw ProblemException.unauthorized("ACCOUNT_INACTIVE", "Account is inactive");
        }
        ClientSession session = newSession(ipAddress, userAgent, ttl);
        session.setAccount(account);
        return persist(session);
    }

    public IssuedSession createAnonymousSession(IpIdentity identity, String ipAddress, String userAgent, Duration ttl) {
        if (identity == null) {
            throw new IllegalArgumentException("identity is required");
        }
        ClientSession session = newSession(ipAddress, userAgent, ttl);
        session.setIpIdentity(identity);
        return persist(session);
    }

    /**
     * Returns the session owning {@code token} when it is active, unexpired and, for account sessions,
     * the account is still active. Sessions failing the expiry or account check are deactivated here.
     */
    public Optional<ClientSession> validateSession(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Optional<ClientSession> found = sessionRepository.findActiveByTokenHashForUpdate(tokenGenerator.hash(token));
        if (found.isEmpty()) {
            return Optional.empty();
        }

        ClientSession session = found.get();
        if (!session.isActive()) {
            return Optional.empty();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (session.isExpiredAt(now)) {
            session.deactivate(now, REASON_EXPIRED);
            log.debug("Session {} expired at {}", session.getId(), session.getExpiresAt());
            return Optional.empty();
        }
        Account account = session.getAccount();
        if (account != null && !account.isActive()) {
            session.deactivate(now, REASON_ACCOUNT_INACTIVE);
            log.info("Session {} revoked: account {} is inactive", session.getId(), account.getId());
            return Optional.empty();
        }
        Hibernate.initialize(session.getIpIdentity());
        session.setLastActivityAt(now);
        return Optional.of(session);
    }

    @Transactional(readOnly = true)
    public Optional<ClientSession> findByToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return sessionRepository.findByTokenHash(tokenGenerator.hash(token));
    }

    /**
     * Deactivates the session owning {@code token}. Returns false only when no such session exists;
     * revoking an already inactive session is a no-op that still returns true.
     */
    public boolean revokeSession(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        Optional<ClientSession> found = sessionRepository.findByTokenHash(tokenGenerator.hash(token));
        if (found.isEmpty()) {
            return false;
        }
        ClientSession session = found.get();
        if (session.deactivate(OffsetDateTime.now(clock), REASON_LOGOUT)) {
            log.info("Session {} revoked", session.getId());
        }
        return true;
    }

    public int revokeAllForAccount(Long accountId, String reason) {
        int revoked = sessionRepository.revokeAllForAccount(accountId, OffsetDateTime.now(clock), reason);
        if (revoked > 0) {
            log.info("Revoked {} session(s) of account {} ({})", revoked, accountId, reason);
        }
        return revoked;
    }

    @Transactional(readOnly = true)
    public long countActiveSessions() {
        return sessionRepository.countByActiveTrue();
    }

    public Duration defaultTtl() {
        return properties.ttl();
    }

    private ClientSession newSession(String ipAddress, String userAgent, Duration ttl) {
        Duration effectiveTtl = ttl != null ? ttl : properties.ttl();
        if (effectiveTtl.isNegative()) {
            throw ProblemException.badRequest("INVALID_TTL", "Session TTL must not be negative");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        ClientSession session = new ClientSession();
        session.setIpAddress(ipAddress);
        session.setUserAgent(truncate(userAgent, 500));
        session.setIssuedAt(now);
        session.setLastActivityAt(now);
        session.setExpiresAt(now.plus(effectiveTtl));
        return session;
    }

    private IssuedSession persist(ClientSession session) {
        String token = tokenGenerator.newToken();
        session.setTokenHash(tokenGenerator.hash(token));
        try {
            ClientSession saved = sessionRepository.saveAndFlush(session);
            return new IssuedSession(saved, token);
        } catch (DataIntegrityViolationException ex) {
            throw new IllegalStateException("Session token collision", ex);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
