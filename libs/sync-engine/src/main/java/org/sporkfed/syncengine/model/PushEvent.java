package org.sporkfed.syncengine.model;

/**
 * The parts of a push notification the engine acts on.
 *
 * @param headCommitId id of the pushed head commit; {@code null} when the push carries none,
 *                     e.g. when a branch was deleted
 * @param installationId GitHub App installation the event was delivered for, if any
 */
public record PushEvent(
        String deliveryId,
        String ref,
        String after,
        String defaultBranch,
        String headCommitId,
        String owner,
        String repository,
        Long installationId
) {
    public static final String BRANCH_REF_PREFIX = "refs/heads/";

    public boolean isDefaultBranchPush() {
        return defaultBranch != null && (BRANCH_REF_PREFIX + defaultBranch).equals(ref);
    }

    public boolean hasHeadCommit() {
        return headCommitId != null;
    }

    public RepoCoordinates repositoryCoordinates() {
        return new RepoCoordinates(owner, repository);
    }
}
