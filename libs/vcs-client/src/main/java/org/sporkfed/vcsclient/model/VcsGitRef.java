package org.sporkfed.vcsclient.model;

/**
 * A git reference and the commit it points at.
 */
public record VcsGitRef(
        String ref,
        String objectSha
) {
}
