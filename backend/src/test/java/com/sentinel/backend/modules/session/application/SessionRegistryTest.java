package com.sentinel.backend.modules.session.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.modules.account.domain.Account;
import com.sentinel.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.sentinel.backend.modules.session.domain.ClientSession;
import com.sentinel.backend.modules.session.infrastructure.persistence.ClientSessionRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class SessionRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private ClientSessionRepository sessionRepository;

    @Mock
    private AccountRepository accountRepository;

    private final SessionTokenGenerator tokenGenerator = new SessionTokenGenerator();

    private SessionRegistry sessionRegistry;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        SessionProperties properties = new SessionProperties(Duration.ofHours(24), false, "Lax");
        sessionRegistry = new SessionRegistry(sessionRepository, accountRepository, tokenGenerator, properties, clock);
    }

    @Test
    void createSessionStoresHashAndDefaultExpiry() {
        Account account = account(7L, true);
        when(accountRepository.findById(7L)).thenReturn(Optional.of(account));
        when(sessionRepository.saveAndFlush(any(ClientSession.class))).thenAnswer(inv -> inv.getArgument(0));

        IssuedSession issued = sessionRegistry.createSession(7L, "10.0.0.1", "curl/8", null);

        ClientSession session = issued.session();
        assertThat(issued.token()).isNotBlank();
        assertThat(session.getTokenHash()).isEqualTo(tokenGenerator.hash(issued.token()));
        assertThat(session.getTokenHash()).isNotEqualTo(issued.token());
        assertThat(session.getExpiresAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusHours(24));
        assertThat(session.isActive()).isTrue();
        assertThat(session.getAccount()).isSameAs(account);
    }

    @Test
    void createSessionRejectsInactiveAccount() {
        when(accountRepository.findById(7L)).thenReturn(Optional.of(account(7L, false)));

        ProblemException ex = assertThrows(ProblemException.class,
                () -> sessionRegistry.createSession(7L, "10.0.0.1", null, null));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(ex.getCode()).isEqualTo("ACCOUNT_INACTIVE");
        verify(sessionRepository, never()).saveAndFlush(any());
    }

    @Test
    void createSessionRejectsUnknownAccount() {
        when(accountRepository.findById(99L)).thenReturn(Optional.empty());

        ProblemException ex = assertThrows(ProblemException.class,
                () -> sessionRegistry.createSession(99L, "10.0.0.1", null, null));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void negativeTtlIsRejected() {
        when(accountRepository.findById(7L)).thenReturn(Optional.of(account(7L, true)));

        ProblemException ex = assertThrows(ProblemException.class,
                () -> sessionRegistry.createSession(7L, "10.0.0.1", null, Duration.ofSeconds(-1)));

        assertThat(ex.getCode()).isEqualTo("INVALID_TTL");
    }

    @Test
    void zeroTtlSessionIsExpiredOnFirstValidation() {
        when(accountRepository.findById(7L)).thenReturn(Optional.of(account(7L, true)));
        when(sessionRepository.saveAndFlush(any(ClientSession.class))).thenAnswer(inv -> inv.getArgument(0));
        IssuedSession issued = sessionRegistry.createSession(7L, "10.0.0.1", null, Duration.ZERO);
        ClientSession session = issued.session();
        when(sessionRepository.findActiveByTokenHashForUpdate(session.getTokenHash())).thenReturn(Optional.of(session));

        Optional<ClientSession> validated = sessionRegistry.validateSession(issued.token());

        assertThat(validated).isEmpty();
        assertThat(session.isActive()).isFalse();
        assertThat(session.getRevokedReason()).isEqualTo(SessionRegistry.REASON_EXPIRED);
    }

    @Test
    void expiredSessionIsDeactivatedOnlyOnce() {
        ClientSession session = spy(activeSession(account(7L, true), OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC)));
        when(sessionRepository.findActiveByTokenHashForUpdate(tokenGenerator.hash("tok"))).thenReturn(Optional.of(session));
        SessionRegistry later = new SessionRegistry(sessionRepository, accountRepository, tokenGenerator,
                new SessionProperties(Duration.ofHours(24), false, "Lax"), Clock.fixed(NOW.plusSeconds(3600), ZoneOffset.UTC));

        assertThat(sessionRegistry.validateSession("tok")).isEmpty();
        OffsetDateTime firstRevokedAt = session.getRevokedAt();
        assertThat(later.validateSession("tok")).isEmpty();

        verify(session, times(1)).deactivate(any(), any());
        assertThat(session.isActive()).isFalse();
        assertThat(session.getRevokedAt()).isEqualTo(firstRevokedAt).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(session.getRevokedReason()).isEqualTo(SessionRegistry.REASON_EXPIRED);
    }

    @Test
    void validateRevokesSessionOfDeactivatedAccount() {
        Account account = account(7L, true);
        ClientSession session = activeSession(account, OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusHours(1));
        when(sessionRepository.findActiveByTokenHashForUpdate(tokenGenerator.hash("tok"))).thenReturn(Optional.of(session));
        account.setActive(false);

        assertThat(sessionRegistry.validateSession("tok")).isEmpty();
        assertThat(session.getRevokedReason()).isEqualTo(SessionRegistry.REASON_ACCOUNT_INACTIVE);
    }

    @Test
    void validateTouchesLastActivity() {
        ClientSession session = activeSession(account(7L, true), OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusHours(1));
        session.setLastActivityAt(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).minusMinutes(10));
        when(sessionRepository.findActiveByTokenHashForUpdate(tokenGenerator.hash("tok"))).thenReturn(Optional.of(session));

        assertThat(sessionRegistry.validateSession("tok")).contains(session);
        assertThat(session.getLastActivityAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    void blankTokenNeverHitsRepository() {
        assertThat(sessionRegistry.validateSession(" ")).isEmpty();
        assertThat(sessionRegistry.revokeSession(null)).isFalse();
        verify(sessionRepository, never()).findActiveByTokenHashForUpdate(any());
    }

    @Test
    void revokeIsIdempotentForKnownToken() {
        ClientSession session = activeSession(account(7L, true), OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusHours(1));
        when(sessionRepository.findByTokenHash(tokenGenerator.hash("tok"))).thenReturn(Optional.of(session));

        assertThat(sessionRegistry.revokeSession("tok")).isTrue();
        OffsetDateTime firstRevokedAt = session.getRevokedAt();
        assertThat(sessionRegistry.revokeSession("tok")).isTrue();

        assertThat(session.isActive()).isFalse();
        assertThat(session.getRevokedAt()).isEqualTo(firstRevokedAt);
        assertThat(session.getRevokedReason()).isEqualTo(SessionRegistry.REASON_LOGOUT);
    }

    @Test
    void revokeUnknownTokenReturnsFalse() {
        when(sessionRepository.findByTokenHash(tokenGenerator.hash("nope"))).thenReturn(Optional.empty());

        assertThat(sessionRegistry.revokeSession("nope")).isFalse();
    }

    private static Account account(Long id, boolean active) {
        Account account = new Account();
        ReflectionTestUtils.setField(account, "id", id);
        account.setName("Ana");
        account.setEmail("ana@example.com");
        account.setActive(active);
        return account;
    }

    private static ClientSession activeSession(Account account, OffsetDateTime expiresAt) {
        ClientSession session = new ClientSession();
        ReflectionTestUtils.setField(session, "id", 1L);
        session.setAccount(account);
        session.setTokenHash("hash");
        session.setIssuedAt(expiresAt.minusHours(2));
        session.setLastActivityAt(expiresAt.minusHours(2));
        session.setExpiresAt(expiresAt);
        return session;
    }
}
