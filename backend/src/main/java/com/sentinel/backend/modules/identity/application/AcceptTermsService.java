package com.sentinel.backend.modules.identity.application;

import java.util.Map;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.modules.audit.application.AuditActions;
import com.sentinel.backend.modules.audit.application.AuditLogService;
import com.sentinel.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.sentinel.backend.modules.audit.domain.AuditSeverity;
import com.sentinel.backend.modules.identity.application.IpIdentityService.IdentityResolution;
import com.sentinel.backend.modules.identity.domain.IpIdentity;
import com.sentinel.backend.modules.identity.presentation.dto.AcceptTermsRequest;
import com.sentinel.backend.modules.identity.presentation.dto.AcceptTermsResponse;
import com.sentinel.backend.modules.session.application.IssuedSession;
import com.sentinel.backend.modules.session.application.SessionRegistry;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Accept-terms flow: resolves the caller's IP identity and opens an account-less session for it.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class AcceptTermsService {

    private final IpIdentityService identityService;
    private final SessionRegistry sessionRegistry;
    private final AuditLogService auditLogService;

    public AcceptTermsService(
            IpIdentityService identityService,
            SessionRegistry sessionRegistry,
            AuditLogService auditLogService
    ) {
        this.identityService = identityService;
        this.sessionRegistry = sessionRegistry;
        this.auditLogService = auditLogService;
    }

    public AcceptTermsResult accept(AcceptTermsRequest request, String ipAddress, String userAgent) {
        if (request != null && Boolean.FALSE.equals(request.acceptTerms())) {
            throw ProblemException.badRequest("TERMS_NOT_ACCEPTED", "Terms must be accepted to continue");
        }
        Map<String, Object> systemInfo = request != null ? request.systemInfo() : null;

        IdentityResolution resolution = identityService.getOrCreate(ipAddress, userAgent, systemInfo);
        IpIdentity identity = resolution.identity();
        IssuedSession issued = sessionRegistry.createAnonymousSession(identity, ipAddress, userAgent, null);

        String action = resolution.isNew() ? AuditActions.IDENTITY_CREATED : AuditActions.IDENTITY_RETURNING;
        auditLogService.record(new AuditLogCommand(null, action,
                "Terms accepted by " + identity.getUsername(), ipAddress, userAgent, AuditSeverity.INFO,
                Map.of("username", identity.getUsername(), "totalVisits", identity.getTotalVisits())));

        AcceptTermsResponse response = new AcceptTermsResponse(true, identity.getUsername(), resolution.isNew(),
                identity.getTotalVisits());
        return new AcceptTermsResult(issued, response);
    }

    public record AcceptTermsResult(IssuedSession session, AcceptTermsResponse response) {
    }
}
