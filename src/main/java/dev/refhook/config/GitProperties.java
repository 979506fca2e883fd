package dev.refhook.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Git data accessor endpoint. timeout caps a single commit resolution.
 */
@ConfigurationProperties(prefix = "refhook.git")
public record GitProperties(String baseUrl, Duration timeout) {
    public GitProperties {
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:3001";
        if (timeout == null) timeout = Duration.ofSeconds(10);
    }
}
