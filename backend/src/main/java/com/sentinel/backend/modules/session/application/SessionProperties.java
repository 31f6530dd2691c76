package com.sentinel.backend.modules.session.application;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Session settings bound from {@code app.session.*}.
 *
 * @param ttl           lifetime of a new session, 24 hours unless configured
 * @param secureCookies whether session cookies carry the {@code Secure} attribute
 * @param sameSite      {@code SameSite} attribute of session cookies
 */
@ConfigurationProperties(prefix = "app.session")
public record SessionProperties(
        @DefaultValue("24h") Duration ttl,
        @DefaultValue("false") boolean secureCookies,
        @DefaultValue("Lax") String sameSite
) {
}
