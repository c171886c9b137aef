package org.sporkfed.syncengine.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.sporkfed.syncengine.model.RepoCoordinates;

/**
 * One mirroring relation: keep {@code target.path} in the configured repository equal to
 * {@code upstream.path} of the upstream repository.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncRule(
        Upstream upstream,
        Target target
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Upstream(
            Repo repo,
            String branch,
            String path
    ) {
        public RepoCoordinates coordinates() {
            return new RepoCoordinates(repo.owner(), repo.name());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Repo(
            String owner,
            String name
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Target(
            String path,
            String branch
    ) {
    }

    /**
     * @return a description of the first missing required field, or {@code null} if the rule is complete
     */
    public String validate() {
        if (upstream == null) {
            return "upstream is required";
        }
        if (upstream.repo() == null || isBlank(upstream.repo().owner()) || isBlank(upstream.repo().name())) {
            return "upstream.repo.owner and upstream.repo.name are required";
        }
        if (isBlank(upstream.path())) {
            return "upstream.path is required";
        }
        if (target == null || isBlank(target.path())) {
            return "target.path is required";
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String toString() {
        String source = upstream == null || upstream.repo() == null
                ? "?"
                : upstream.repo().owner() + "/" + upstream.repo().name() + ":" + upstream.path();
        return source + " -> " + (target == null ? "?" : target.path());
    }
}
