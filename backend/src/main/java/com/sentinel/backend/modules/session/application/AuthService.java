package com.sentinel.backend.modules.session.application;

import java.util.Optional;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.global.security.SessionPrincipal;
import com.sentinel.backend.modules.account.application.CredentialService;
import com.sentinel.backend.modules.account.domain.Account;
import com.sentinel.backend.modules.account.presentation.dto.AccountResponse;
import com.sentinel.backend.modules.audit.application.AuditActions;
import com.sentinel.backend.modules.audit.application.AuditLogService;
import com.sentinel.backend.modules.session.domain.ClientSession;
import com.sentinel.backend.modules.session.presentation.dto.LoginRequest;
import com.sentinel.backend.modules.session.presentation.dto.LoginResponse;
import com.sentinel.backend.modules.session.presentation.dto.SessionClientResponse;
import com.sentinel.backend.modules.session.presentation.dto.ValidateResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Email/password login, logout and session introspection.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class AuthService {

    private final CredentialService credentialService;
    private final SessionRegistry sessionRegistry;
    private final AuditLogService auditLogService;

    public AuthService(
            CredentialService credentialService,
            SessionRegistry sessionRegistry,
            AuditLogService auditLogService
    ) {
        this.credentialService = credentialService;
        this.sessionRegistry = sessionRegistry;
        this.auditLogService = auditLogService;
    }

    public LoginResult login(LoginRequest request, String ipAddress, String userAgent) {
        Account account = credentialService.authenticate(request.email(), request.password(), ipAddress);
        IssuedSession issued = sessionRegistry.createSession(account.getId(), ipAddress, userAgent, null);
        LoginResponse response = new LoginResponse(true, issued.token(), AccountResponse.from(account));
        return new LoginResult(issued, response);
    }

    /**
     * Revokes the session owning {@code token}, if any. Unknown tokens are ignored.
     */
    public void logout(String token, String ipAddress) {
        Optional<ClientSession> session = sessionRegistry.findByToken(token);
        if (session.isEmpty()) {
            return;
        }
        boolean wasActive = session.get().isActive();
        sessionRegistry.revokeSession(token);
        if (wasActive) {
            Account account = session.get().getAccount();
            auditLogService.record(account != null ? account.getId() : null, AuditActions.LOGOUT,
                    "Session " + session.get().getId() + " closed", ipAddress);
        }
    }

    @Transactional(readOnly = true)
    public ValidateResponse describe(SessionPrincipal principal) {
        if (principal.isAnonymous()) {
            return new ValidateResponse(true, true, SessionClientResponse.ofIdentity(principal.displayName()));
        }
        Account account = credentialService.lookupById(principal.accountId())
                .orElseThrow(() -> ProblemException.unauthorized("INVALID_SESSION", "Session invalid or expired"));
        return new ValidateResponse(true, true, SessionClientResponse.ofAccount(account));
    }

    public record LoginResult(IssuedSession session, LoginResponse response) {
    }
}
