package dev.refhook.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "refhook.urls")
public record UrlProperties(String gitBaseUrl) {
    public UrlProperties { if (gitBaseUrl == null || gitBaseUrl.isBlank()) gitBaseUrl = "http://localhost:3000/git"; }
}
