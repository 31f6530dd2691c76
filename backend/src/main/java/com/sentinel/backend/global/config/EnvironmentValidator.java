package com.sentinel.backend.global.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String DEFAULT_ADMIN_PASSWORD = "admin123";

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missingVars = new ArrayList<>();
        List<String> invalidVars = new ArrayList<>();

        String[] requiredVars = {
            "spring.datasource.url",
            "app.session.ttl",
            "app.cors.allowed-origins"
        };

        for (String var : requiredVars) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.isEmpty() || value.map(String::trim).orElse("").isEmpty()) {
                missingVars.add(var);
            }
        }

        Optional.ofNullable(environment.getProperty("app.session.ttl")).ifPresent(raw -> {
            try {
                Duration ttl = DurationStyle.detectAndParse(raw.trim());
                if (ttl.isNegative() || ttl.compareTo(Duration.ofDays(30)) > 0) {
                    invalidVars.add("app.session.ttl: must be between 0 and 30 days");
                }
            } catch (IllegalArgumentException e) {
                invalidVars.add("app.session.ttl: not a duration");
            }
        });

        boolean adminSeedEnabled = environment.getProperty("app.admin.enabled", Boolean.class, true);
        if (adminSeedEnabled && DEFAULT_ADMIN_PASSWORD.equals(environment.getProperty("app.admin.password"))) {
            log.warn("Bootstrap admin still uses the default password; change app.admin.password");
        }

        if (!missingVars.isEmpty() || !invalidVars.isEmpty()) {
            if (!missingVars.isEmpty()) {
                log.error("Missing required settings: {}", String.join(", ", missingVars));
            }
            invalidVars.forEach(v -> log.error("Invalid setting: {}", v));
            throw new IllegalStateException("Environment validation failed");
        }

        log.info("Environment validation passed");
    }
}
