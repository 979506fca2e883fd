package dev.refhook.webhook.payload;

public record IdentityInfo(String name, String email) {}
