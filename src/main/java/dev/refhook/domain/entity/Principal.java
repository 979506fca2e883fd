package dev.refhook.domain.entity;

import dev.refhook.domain.enums.PrincipalType;

/**
 * Acting user or service. Owned by the principal store; read-only here.
 * Timestamps are epoch milliseconds.
 */
public record Principal(
        long id,
        String uid,
        String email,
        String displayName,
        PrincipalType type,
        boolean admin,
        long created,
        long updated
) {}
