package com.sentinel.backend.modules.session.application;

import com.sentinel.backend.modules.session.domain.ClientSession;

/**
 * A freshly created session together with its raw token, which only exists in memory.
 */
public record IssuedSession(ClientSession session, String token) {
}
