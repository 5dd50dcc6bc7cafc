package com.buildsync.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Schema entity addressed by an environment-local id and identified across environments by its name
 * (or another attribute chosen by the caller).
 */
public interface NamedEntity {

    /** Environment-local id; the key under which the entity is stored in its container. */
    String getId();

    String getName();

    /** Raw attribute of the entity body; a missing node when absent. */
    JsonNode getAttribute(String attribute);
}
