package com.keywordalert.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.dispatch")
public record DispatchProperties(
        Integer maxAttempts,
        Duration retryBackoff,
        Integer threads,
        Integer queueCapacity
) {
    public DispatchProperties {
        if (maxAttempts == null || maxAttempts < 1) {
            maxAttempts = 3;
        }
        if (retryBackoff == null || retryBackoff.isNegative()) {
            retryBackoff = Duration.ofSeconds(1);
        }
        if (threads == null || threads < 1) {
            threads = 4;
        }
        if (queueCapacity == null || queueCapacity < 1) {
            queueCapacity = 500;
        }
    }

    public static DispatchProperties defaults() {
        return new DispatchProperties(null, null, null, null);
    }
}
