package dev.refhook.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Event intake tuning. Queue names are bound directly on the listener methods
 * ({@code refhook.events.queues.*}).
 *
 * <p>shutdownTimeout bounds how long in-flight handlers may drain when the
 * application stops.
 */
@ConfigurationProperties(prefix = "refhook.events")
public record EventProperties(int maxConcurrentMessages, Duration shutdownTimeout) {
    public EventProperties {
        if (maxConcurrentMessages <= 0) maxConcurrentMessages = 10;
        if (shutdownTimeout == null) shutdownTimeout = Duration.ofSeconds(20);
    }
}
