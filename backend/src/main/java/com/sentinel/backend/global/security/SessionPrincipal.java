package com.sentinel.backend.global.security;

import com.sentinel.backend.modules.account.domain.AccessLevel;

/**
 * Caller resolved from a valid session. {@code accountId} and {@code accessLevel} are null for
 * sessions opened through the accept-terms flow, which carry {@code ipIdentityId} instead.
 */
public record SessionPrincipal(
        Long sessionId,
        Long accountId,
        Long ipIdentityId,
        String displayName,
        AccessLevel accessLevel
) {

    public boolean isAnonymous() {
        return accountId == null;
    }
}
