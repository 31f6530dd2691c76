package com.sentinel.backend.global.security;

import java.util.Optional;

import com.sentinel.backend.global.error.ProblemException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<SessionPrincipal> currentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof SessionPrincipal principal)) {
            return Optional.empty();
        }
        return Optional.of(principal);
    }

    public static SessionPrincipal getCurrentPrincipal() {
        return currentPrincipal()
                .orElseThrow(() -> ProblemException.unauthorized("UNAUTHORIZED", "Authentication required"));
    }

    public static Long currentAccountId() {
        return currentPrincipal().map(SessionPrincipal::accountId).orElse(null);
    }
}
