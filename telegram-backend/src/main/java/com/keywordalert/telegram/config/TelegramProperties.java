package com.keywordalert.telegram.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.telegram")
public record TelegramProperties(
        @NotBlank String botToken,
        @NotBlank String apiBase,
        Duration connectTimeout,
        Duration readTimeout
) {
    public TelegramProperties {
        connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(5);
        readTimeout = readTimeout != null ? readTimeout : Duration.ofSeconds(10);
    }
}
