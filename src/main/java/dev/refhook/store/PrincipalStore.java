package dev.refhook.store;

import dev.refhook.domain.entity.Principal;

import java.util.Optional;

public interface PrincipalStore {
    Optional<Principal> findById(long id);
}
