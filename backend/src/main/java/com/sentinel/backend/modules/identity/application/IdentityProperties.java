package com.sentinel.backend.modules.identity.application;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Limits applied to client-reported metadata, bound from {@code app.identity.*}.
 */
@ConfigurationProperties(prefix = "app.identity")
public record IdentityProperties(
        @DefaultValue("50") int maxMetadataEntries,
        @DefaultValue("500") int maxMetadataValueLength
) {
}
