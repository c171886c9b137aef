package org.sporkfed.vcsclient.model;

public record VcsPullRequest(
        long number,
        String title,
        String state,
        String headRef,
        String baseRef,
        String htmlUrl
) {
}
