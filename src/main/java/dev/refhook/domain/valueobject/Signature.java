package dev.refhook.domain.valueobject;

import java.time.Instant;

public record Signature(Identity identity, Instant when) {}
