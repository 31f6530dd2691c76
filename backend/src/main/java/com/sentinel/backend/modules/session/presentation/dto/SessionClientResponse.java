package com.sentinel.backend.modules.session.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sentinel.backend.modules.account.domain.AccessLevel;
import com.sentinel.backend.modules.account.domain.Account;

/**
 * Caller behind a session: an account, or only the IP identity username for accept-terms sessions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionClientResponse(
        Long id,
        String name,
        String email,
        AccessLevel accessLevel,
        String username,
        boolean anonymous
) {

    public static SessionClientResponse ofAccount(Account account) {
        return new SessionClientResponse(account.getId(), account.getName(), account.getEmail(),
                account.getAccessLevel(), null, false);
    }

    public static SessionClientResponse ofIdentity(String username) {
        return new SessionClientResponse(null, null, null, null, username, true);
    }
}
