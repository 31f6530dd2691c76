package com.sentinel.backend.modules.account.application;

import com.sentinel.backend.modules.account.application.CredentialService.AccountAttributes;
import com.sentinel.backend.modules.account.domain.AccessLevel;
import com.sentinel.backend.modules.account.domain.Account;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Creates the bootstrap administrator on startup when no account holds the configured email.
 */
@Component
public class AdminAccountInitializer {

    private static final Logger log = LoggerFactory.getLogger(AdminAccountInitializer.class);

    private final CredentialService credentialService;
    private final boolean enabled;
    private final String adminEmail;
    private final String adminPassword;
    private final String adminName;

    public AdminAccountInitializer(
            CredentialService credentialService,
            @Value("${app.admin.enabled:true}") boolean enabled,
            @Value("${app.admin.email:admin@sistema.local}") String adminEmail,
            @Value("${app.admin.password:admin123}") String adminPassword,
            @Value("${app.admin.name:Administrador}") String adminName
    ) {
        this.credentialService = credentialService;
        this.enabled = enabled;
        this.adminEmail = adminEmail;
        this.adminPassword = adminPassword;
        this.adminName = adminName;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initializeAdminAccount() {
        if (!enabled || adminEmail == null || adminEmail.isBlank() || adminPassword == null || adminPassword.isBlank()) {
            log.debug("Admin initialization skipped");
            return;
        }
        if (credentialService.lookupByEmail(adminEmail).isPresent()) {
            log.debug("Admin account already exists: {}", maskEmail(adminEmail));
            return;
        }

        Account admin = credentialService.createAccount(adminName, adminEmail, adminPassword,
                AccountAttributes.withAccessLevel(AccessLevel.ADMIN));
        log.info("Admin account {} created: {}", admin.getId(), maskEmail(admin.getEmail()));
    }

    static String maskEmail(String email) {
        if (email == null) {
            return "***";
        }
        int at = email.indexOf('@');
        if (at < 0) {
            return "***";
        }
        return email.substring(0, Math.min(3, at)) + "***@" + email.substring(at + 1);
    }
}
