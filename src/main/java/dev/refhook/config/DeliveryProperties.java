package dev.refhook.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "refhook.delivery")
public record DeliveryProperties(String queue) {
    public DeliveryProperties { if (queue == null || queue.isBlank()) queue = "webhook-delivery"; }
}
