package com.buildsync.reconcile.match;

import com.buildsync.model.NamedEntity;

/**
 * Extracts the key under which entities of two environments are considered the same.
 * Ids are environment-local and are never compared across environments; the match key is.
 */
@FunctionalInterface
public interface MatchKeyStrategy {

    /** Matches entities by {@code name}. */
    MatchKeyStrategy BY_NAME = new NameMatchKeyStrategy();

    /**
     * @return match key of the entity, or {@code null} when the entity cannot be matched (it is then left out of indexes)
     */
    String keyOf(NamedEntity entity);
}
