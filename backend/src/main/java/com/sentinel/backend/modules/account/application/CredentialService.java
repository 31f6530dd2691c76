package com.sentinel.backend.modules.account.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.modules.account.domain.AccessLevel;
import com.sentinel.backend.modules.account.domain.Account;
import com.sentinel.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.sentinel.backend.modules.audit.application.AuditActions;
import com.sentinel.backend.modules.audit.application.AuditLogService;
import com.sentinel.backend.modules.audit.application.AuditLogService.AuditLogCommand;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Account credentials: creation with a unique email, BCrypt password hashes and email/password
 * authentication. Authentication failures are reported without saying whether the email exists.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class CredentialService {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    public static final String DUPLICATE_EMAIL = "DUPLICATE_EMAIL";

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public CredentialService(
            AccountRepository accountRepository,
            PasswordEncoder passwordEncoder,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public Account createAccount(String name, String email, String rawPassword, AccountAttributes attributes) {
        String normalizedEmail = normalizeEmail(email);
        if (name == null || name.isBlank()) {
            throw ProblemException.badRequest("NAME_REQUIRED", "Name is required");
        }
        if (normalizedEmail == null) {
            throw ProblemException.badRequest("EMAIL_REQUIRED", "Email is required");
        }
        if (accountRepository.existsByEmailIgnoreCase(normalizedEmail)) {
            throw ProblemException.conflict(DUPLICATE_EMAIL, "Email already registered");
        }

        Account account = new Account();
        account.setName(name.trim());
        account.setEmail(normalizedEmail);
        AccountAttributes attrs = attributes != null ? attributes : AccountAttributes.empty();
        attrs.applyTo(account);
        if (rawPassword != null && !rawPassword.isEmpty()) {
            account.setPasswordHash(passwordEncoder.encode(rawPassword));
        }

        Account saved = accountRepository.saveAndFlush(account);
        log.info("Account {} created with access level {}", saved.getId(), saved.getAccessLevel());
        auditLogService.record(saved.getId(), AuditActions.ACCOUNT_CREATED,
                "Account " + saved.getName() + " created", null);
        return saved;
    }

    public void setPassword(Account account, String rawPassword) {
        if (rawPassword == null || rawPassword.isEmpty()) {
            throw ProblemException.badRequest("PASSWORD_REQUIRED", "Password is required");
        }
        account.setPasswordHash(passwordEncoder.encode(rawPassword));
        accountRepository.save(account);
        auditLogService.record(account.getId(), AuditActions.PASSWORD_CHANGED, "Password changed", null);
    }

    public boolean verifyPassword(Account account, String rawPassword) {
        if (account == null || !account.hasPassword() || rawPassword == null) {
            return false;
        }
        return passwordEncoder.matches(rawPassword, account.getPasswordHash());
    }

    public Account authenticate(String email, String rawPassword) {
        return authenticate(email, rawPassword, null);
    }

    /**
     * Authenticates an active account. Unknown email, inactive account and wrong password
     * all produce the same {@code INVALID_CREDENTIALS} failure.
     */
    public Account authenticate(String email, String rawPassword, String ipAddress) {
        Optional<Account> candidate = Optional.ofNullable(normalizeEmail(email))
                .flatMap(accountRepository::findActiveByEmailIgnoreCase);

        if (candidate.isEmpty() || !verifyPassword(candidate.get(), rawPassword)) {
            Long accountId = candidate.map(Account::getId).orElse(null);
            auditLogService.record(AuditLogCommand.warning(accountId, AuditActions.LOGIN_FAILED,
                    "Login failed", ipAddress));
            throw ProblemException.unauthorized("INVALID_CREDENTIALS", "Invalid credentials");
        }

        Account account = candidate.get();
        OffsetDateTime now = OffsetDateTime.now(clock);
        account.setLastAccessAt(now);
        accountRepository.save(account);
        auditLogService.record(account.getId(), AuditActions.LOGIN, "Login succeeded", ipAddress);
        return account;
    }

    @Transactional(readOnly = true)
    public Optional<Account> lookupByEmail(String email) {
        return Optional.ofNullable(normalizeEmail(email)).flatMap(accountRepository::findByEmailIgnoreCase);
    }

    @Transactional(readOnly = true)
    public Optional<Account> lookupById(Long accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        return accountRepository.findById(accountId);
    }

    public void touchLastAccess(Long accountId) {
        accountRepository.touchLastAccess(accountId, OffsetDateTime.now(clock));
    }

    static String normalizeEmail(String email) {
        if (email == null) {
            return null;
        }
        String trimmed = email.trim();
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * Optional profile attributes accepted at account creation.
     */
    public record AccountAttributes(
            String phone,
            String company,
            String jobTitle,
            String address,
            String city,
            String state,
            String country,
            String postalCode,
            String taxId,
            AccessLevel accessLevel,
            String notes,
            Map<String, String> extraData
    ) {

        public static AccountAttributes empty() {
            return new AccountAttributes(null, null, null, null, null, null, null, null, null, null, null, null);
        }

        public static AccountAttributes withAccessLevel(AccessLevel accessLevel) {
            return new AccountAttributes(null, null, null, null, null, null, null, null, null, accessLevel, null, null);
        }

        void applyTo(Account account) {
            account.setPhone(phone);
            account.setCompany(company);
            account.setJobTitle(jobTitle);
            account.setAddress(address);
            account.setCity(city);
            account.setState(state);
            account.setCountry(country != null && !country.isBlank() ? country : Account.DEFAULT_COUNTRY);
            account.setPostalCode(postalCode);
            account.setTaxId(taxId);
            account.setAccessLevel(accessLevel != null ? accessLevel : AccessLevel.USER);
            account.setNotes(notes);
            account.setExtraData(extraData);
        }
    }
}
