package com.unifiedplatform.backend.global.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "server.port"
    };

    private final Environment environment;
    private final PlatformProperties properties;

    public EnvironmentValidator(Environment environment, PlatformProperties properties) {
        this.environment = environment;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missingVars = new ArrayList<>();
        List<String> invalidVars = new ArrayList<>();

        for (String var : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missingVars.add(var);
            }
        }

        Duration lockTimeout = properties.store().lockTimeout();
        if (lockTimeout.isNegative() || lockTimeout.isZero()) {
            invalidVars.add("platform.store.lock-timeout: must be positive");
        }
        if (properties.cors().allowedOrigins().isEmpty()) {
            invalidVars.add("platform.cors.allowed-origins: at least one origin required");
        }

        if (!missingVars.isEmpty() || !invalidVars.isEmpty()) {
            missingVars.forEach(v -> log.error("Missing required property: {}", v));
            invalidVars.forEach(v -> log.error("Invalid property: {}", v));
            throw new IllegalStateException("Environment validation failed: missing=" + missingVars
                    + ", invalid=" + invalidVars);
        }

        log.info("Environment validated (lock timeout {}, cors origins {})",
                lockTimeout, properties.cors().allowedOrigins());
    }
}
