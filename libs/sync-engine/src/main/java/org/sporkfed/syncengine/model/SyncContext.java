package org.sporkfed.syncengine.model;

import org.sporkfed.vcsclient.VcsClient;

/**
 * Working set of one push event: an authorized client, the pushed repository and its default branch.
 * Rules of the same push share the context but never mutate it.
 */
public record SyncContext(
        VcsClient client,
        RepoCoordinates repository,
        String defaultBranch
) {
    public String owner() {
        return repository.owner();
    }

    public String repo() {
        return repository.name();
    }
}
