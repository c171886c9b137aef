package org.sporkfed.vcsclient.model;

/**
 * Result of writing a file: the new blob sha and the commit that introduced it.
 */
public record VcsFileCommit(
        String path,
        String contentSha,
        String commitSha
) {
}
