package dev.refhook.store;

import dev.refhook.domain.entity.PullReq;

import java.util.Optional;

/**
 * Read-only access to the externally owned pull request store.
 * Empty means the pull request does not exist; a thrown exception is a backend failure.
 * Implementations must be safe for concurrent use.
 */
public interface PullReqStore {
    Optional<PullReq> findById(long id);
}
