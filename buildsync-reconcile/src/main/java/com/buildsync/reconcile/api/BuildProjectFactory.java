package com.buildsync.reconcile.api;

/**
 * Creates empty build projects in an environment.
 */
public interface BuildProjectFactory {

    /** @return id of the created project */
    String createProject(String name, String org, String workspace);
}
