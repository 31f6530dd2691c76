package com.sentinel.backend.modules.account.application;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.modules.account.application.CredentialService.AccountAttributes;
import com.sentinel.backend.modules.account.domain.Account;
import com.sentinel.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.sentinel.backend.modules.account.presentation.dto.AccountPageResponse;
import com.sentinel.backend.modules.account.presentation.dto.AccountResponse;
import com.sentinel.backend.modules.account.presentation.dto.CreateAccountRequest;
import com.sentinel.backend.modules.account.presentation.dto.UpdateAccountRequest;
import com.sentinel.backend.modules.audit.application.AuditActions;
import com.sentinel.backend.modules.audit.application.AuditLogService;
import com.sentinel.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.sentinel.backend.modules.audit.domain.AuditSeverity;
import com.sentinel.backend.modules.session.application.SessionRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Administrative account management. Deactivation revokes every live session of the account.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 100;

    private final AccountRepository accountRepository;
    private final CredentialService credentialService;
    private final SessionRegistry sessionRegistry;
    private final AuditLogService auditLogService;

    public AccountService(
            AccountRepository accountRepository,
            CredentialService credentialService,
            SessionRegistry sessionRegistry,
            AuditLogService auditLogService
    ) {
        this.accountRepository = accountRepository;
        this.credentialService = credentialService;
        this.sessionRegistry = sessionRegistry;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public AccountPageResponse list(Boolean active, String search, int page, int size) {
        int safePage = Math.max(page, 0);
        int safeSize = size <= 0 ? DEFAULT_PAGE_SIZE : Math.min(size, MAX_PAGE_SIZE);
        String pattern = (search == null || search.isBlank())
                ? null
                : "%" + search.trim().toLowerCase(Locale.ROOT) + "%";

        Page<Account> result = accountRepository.search(active, pattern, PageRequest.of(safePage, safeSize));
        List<AccountResponse> items = result.getContent().stream()
                .map(AccountResponse::from)
                .toList();
        return new AccountPageResponse(items, safePage, safeSize, result.getTotalElements(), result.getTotalPages());
    }

    @Transactional(readOnly = true)
    public AccountResponse get(Long accountId) {
        return AccountResponse.from(load(accountId));
    }

    public AccountResponse create(CreateAccountRequest request) {
        AccountAttributes attributes = new AccountAttributes(
                request.phone(),
                request.company(),
                request.jobTitle(),
                request.address(),
                request.city(),
                request.state(),
                request.country(),
                request.postalCode(),
                request.taxId(),
                request.accessLevel(),
                request.notes(),
                request.extraData()
        );
        Account account = credentialService.createAccount(request.name(), request.email(), request.password(), attributes);
        return AccountResponse.from(account);
    }

    @Transactional
    public AccountResponse update(Long accountId, UpdateAccountRequest request, Long actorId, String ipAddress) {
        Account account = load(accountId);
        boolean deactivated = Boolean.FALSE.equals(request.active()) && account.isActive();
        if (deactivated) {
            guardSelf(accountId, actorId);
        }
        String email = request.email() == null ? null : CredentialService.normalizeEmail(request.email());
        boolean emailChanged = email != null && !email.equals(account.getEmail());
        if (emailChanged) {
            credentialService.lookupByEmail(email)
                    .filter(other -> !Objects.equals(other.getId(), accountId))
                    .ifPresent(other -> {
                        throw ProblemException.conflict(CredentialService.DUPLICATE_EMAIL, "Email already registered");
                    });
        }

        List<String> changed = new ArrayList<>();
        if (emailChanged) {
            account.setEmail(email);
            changed.add("email");
        }
        if (request.name() != null && !request.name().isBlank()) {
            account.setName(request.name().trim());
            changed.add("name");
        }
        applyIfPresent(request.phone(), account::setPhone, "phone", changed);
        applyIfPresent(request.company(), account::setCompany, "company", changed);
        applyIfPresent(request.jobTitle(), account::setJobTitle, "jobTitle", changed);
        applyIfPresent(request.address(), account::setAddress, "address", changed);
        applyIfPresent(request.city(), account::setCity, "city", changed);
        applyIfPresent(request.state(), account::setState, "state", changed);
        applyIfPresent(request.country(), account::setCountry, "country", changed);
        applyIfPresent(request.postalCode(), account::setPostalCode, "postalCode", changed);
        applyIfPresent(request.taxId(), account::setTaxId, "taxId", changed);
        applyIfPresent(request.notes(), account::setNotes, "notes", changed);
        if (request.extraData() != null) {
            account.setExtraData(new LinkedHashMap<>(request.extraData()));
            changed.add("extraData");
        }
        if (request.accessLevel() != null && request.accessLevel() != account.getAccessLevel()) {
            account.setAccessLevel(request.accessLevel());
            changed.add("accessLevel");
        }

        if (request.active() != null && request.active() != account.isActive()) {
            account.setActive(request.active());
            changed.add("active");
        }

        Account saved = accountRepository.save(account);
        if (request.password() != null) {
            credentialService.setPassword(saved, request.password());
        }
        if (deactivated) {
            sessionRegistry.revokeAllForAccount(accountId, SessionRegistry.REASON_ACCOUNT_DEACTIVATED);
        }

        if (!changed.isEmpty()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("targetAccountId", accountId);
            payload.put("fields", changed);
            auditLogService.record(new AuditLogCommand(actorId, AuditActions.ACCOUNT_UPDATED,
                    "Account " + accountId + " updated", ipAddress, null, AuditSeverity.INFO, payload));
        }
        return AccountResponse.from(saved);
    }

    /**
     * Soft delete marks the account inactive and revokes its sessions; hard delete removes the row,
     * cascading to sessions, devices and connections while audit entries keep a null actor.
     */
    @Transactional
    public void delete(Long accountId, boolean hard, Long actorId, String ipAddress) {
        Account account = load(accountId);
        guardSelf(accountId, actorId);
        Map<String, Object> payload = Map.of("targetAccountId", accountId, "email", account.getEmail());

        if (hard) {
            accountRepository.delete(account);
            accountRepository.flush();
            log.info("Account {} deleted", accountId);
            auditLogService.record(new AuditLogCommand(actorId, AuditActions.ACCOUNT_DELETED,
                    "Account " + accountId + " deleted", ipAddress, null, AuditSeverity.WARNING, payload));
            return;
        }

        account.setActive(false);
        accountRepository.save(account);
        sessionRegistry.revokeAllForAccount(accountId, SessionRegistry.REASON_ACCOUNT_DEACTIVATED);
        log.info("Account {} deactivated", accountId);
        auditLogService.record(new AuditLogCommand(actorId, AuditActions.ACCOUNT_DEACTIVATED,
                "Account " + accountId + " deactivated", ipAddress, null, AuditSeverity.WARNING, payload));
    }

    private Account load(Long accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> ProblemException.notFound("ACCOUNT_NOT_FOUND", "Account not found"));
    }

    private static void guardSelf(Long accountId, Long actorId) {
        if (actorId != null && actorId.equals(accountId)) {
            throw ProblemException.badRequest("SELF_DEACTIVATION_FORBIDDEN", "Administrators cannot deactivate themselves");
        }
    }

    private static void applyIfPresent(String value, Consumer<String> setter, String field,
                                       List<String> changed) {
        if (value != null) {
            setter.accept(value.isBlank() ? null : value.trim());
            changed.add(field);
        }
    }
}
