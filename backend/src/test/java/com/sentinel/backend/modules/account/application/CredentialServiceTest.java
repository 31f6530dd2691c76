package com.sentinel.backend.modules.account.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.modules.account.application.CredentialService.AccountAttributes;
import com.sentinel.backend.modules.account.domain.AccessLevel;
import com.sentinel.backend.modules.account.domain.Account;
import com.sentinel.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.sentinel.backend.modules.audit.application.AuditActions;
import com.sentinel.backend.modules.audit.application.AuditLogService;
import com.sentinel.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.sentinel.backend.modules.audit.domain.AuditSeverity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class CredentialServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private AuditLogService auditLogService;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private CredentialService credentialService;

    @BeforeEach
    void setUp() {
        credentialService = new CredentialService(accountRepository, passwordEncoder, auditLogService,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createAccountHashesPasswordAndNormalizesEmail() {
        when(accountRepository.existsByEmailIgnoreCase("ana@example.com")).thenReturn(false);
        when(accountRepository.saveAndFlush(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));

        Account account = credentialService.createAccount(" Ana ", " Ana@Example.com ", "secret1",
                AccountAttributes.withAccessLevel(AccessLevel.MODERATOR));

        assertThat(account.getName()).isEqualTo("Ana");
        assertThat(account.getEmail()).isEqualTo("ana@example.com");
        assertThat(account.getPasswordHash()).isNotEqualTo("secret1");
        assertThat(passwordEncoder.matches("secret1", account.getPasswordHash())).isTrue();
        assertThat(account.getAccessLevel()).isEqualTo(AccessLevel.MODERATOR);
        assertThat(account.getCountry()).isEqualTo(Account.DEFAULT_COUNTRY);
    }

    @Test
    void createAccountWithoutPasswordCannotLogIn() {
        when(accountRepository.existsByEmailIgnoreCase("bob@example.com")).thenReturn(false);
        when(accountRepository.saveAndFlush(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));

        Account account = credentialService.createAccount("Bob", "bob@example.com", null, null);

        assertThat(account.hasPassword()).isFalse();
        assertThat(credentialService.verifyPassword(account, "")).isFalse();
        assertThat(account.getAccessLevel()).isEqualTo(AccessLevel.USER);
    }

    @Test
    void duplicateEmailIsConflict() {
        when(accountRepository.existsByEmailIgnoreCase("ana@example.com")).thenReturn(true);

        ProblemException ex = assertThrows(ProblemException.class,
                () -> credentialService.createAccount("Ana", "ANA@example.com", "secret1", null));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ex.getCode()).isEqualTo(CredentialService.DUPLICATE_EMAIL);
        verify(accountRepository, never()).saveAndFlush(any());
    }

    @Test
    void authenticateUpdatesLastAccess() {
        Account account = account(3L, "secret1");
        when(accountRepository.findActiveByEmailIgnoreCase("ana@example.com")).thenReturn(Optional.of(account));

        Account result = credentialService.authenticate("Ana@example.com", "secret1", "10.0.0.1");

        assertThat(result).isSameAs(account);
        assertThat(result.getLastAccessAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        verify(auditLogService).record(3L, AuditActions.LOGIN, "Login succeeded", "10.0.0.1");
    }

    @Test
    void wrongPasswordAndUnknownEmailFailTheSameWay() {
        when(accountRepository.findActiveByEmailIgnoreCase("ana@example.com")).thenReturn(Optional.of(account(3L, "secret1")));
        when(accountRepository.findActiveByEmailIgnoreCase("ghost@example.com")).thenReturn(Optional.empty());

        ProblemException wrongPassword = assertThrows(ProblemException.class,
                () -> credentialService.authenticate("ana@example.com", "nope", "10.0.0.1"));
        ProblemException unknown = assertThrows(ProblemException.class,
                () -> credentialService.authenticate("ghost@example.com", "nope", "10.0.0.1"));

        assertThat(wrongPassword.getCode()).isEqualTo("INVALID_CREDENTIALS");
        assertThat(unknown.getCode()).isEqualTo(wrongPassword.getCode());
        assertThat(unknown.getErrorMessage()).isEqualTo(wrongPassword.getErrorMessage());
        verify(auditLogService).record(argThat((AuditLogCommand command) ->
                AuditActions.LOGIN_FAILED.equals(command.action())
                        && command.severity() == AuditSeverity.WARNING
                        && Long.valueOf(3L).equals(command.accountId())));
    }

    @Test
    void setPasswordReplacesTheOldCredential() {
        Account account = account(3L, "secret1");
        when(accountRepository.findActiveByEmailIgnoreCase("ana@example.com")).thenReturn(Optional.of(account));

        credentialService.setPassword(account, "newpass");

        assertThat(account.getPasswordHash()).doesNotContain("newpass");
        ProblemException oldPassword = assertThrows(ProblemException.class,
                () -> credentialService.authenticate("ana@example.com", "secret1", null));
        assertThat(oldPassword.getCode()).isEqualTo("INVALID_CREDENTIALS");
        assertThat(credentialService.authenticate("ana@example.com", "newpass", null)).isSameAs(account);
        verify(auditLogService).record(3L, AuditActions.PASSWORD_CHANGED, "Password changed", null);
    }

    @Test
    void emptyPasswordIsRejected() {
        Account account = account(3L, "secret1");
        String before = account.getPasswordHash();

        ProblemException ex = assertThrows(ProblemException.class, () -> credentialService.setPassword(account, ""));

        assertThat(ex.getCode()).isEqualTo("PASSWORD_REQUIRED");
        assertThat(account.getPasswordHash()).isEqualTo(before);
        verify(accountRepository, never()).save(any());
    }

    private Account account(Long id, String password) {
        Account account = new Account();
        ReflectionTestUtils.setField(account, "id", id);
        account.setName("Ana");
        account.setEmail("ana@example.com");
        account.setPasswordHash(passwordEncoder.encode(password));
        return account;
    }
}
