package com.unifiedplatform.backend.global.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Platform-level settings bound from the {@code platform.*} namespace.
 */
@ConfigurationProperties(prefix = "platform")
public record PlatformProperties(
        @DefaultValue Cors cors,
        @DefaultValue Store store
) {

    public record Cors(@DefaultValue("*") List<String> allowedOrigins) {
    }

    /**
     * @param lockTimeout       how long a lifecycle write waits for the row lock of the request it mutates
     * @param retryAfterSeconds value advertised in {@code Retry-After} when the store is unavailable
     */
    public record Store(
            @DefaultValue("5s") Duration lockTimeout,
            @DefaultValue("5") int retryAfterSeconds
    ) {
    }
}
