package dev.refhook.store;

import dev.refhook.domain.entity.Repository;

import java.util.Optional;

/**
 * Read-only repository lookup. Source and target repository of a pull request are
 * resolved through separate calls.
 */
public interface RepositoryStore {
    Optional<Repository> findById(long id);
}
