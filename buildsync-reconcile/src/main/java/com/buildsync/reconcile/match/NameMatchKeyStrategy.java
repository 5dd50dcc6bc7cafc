package com.buildsync.reconcile.match;

import com.buildsync.model.NamedEntity;

/** Default strategy: the entity name is the identity key across environments. */
public final class NameMatchKeyStrategy implements MatchKeyStrategy {

    @Override
    public String keyOf(NamedEntity entity) {
        return entity != null ? entity.getName() : null;
    }

    @Override
    public String toString() {
        return "name";
    }
}
