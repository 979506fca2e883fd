package dev.refhook.webhook.payload;

public record ReferenceSegment(ReferenceInfo ref) {}
