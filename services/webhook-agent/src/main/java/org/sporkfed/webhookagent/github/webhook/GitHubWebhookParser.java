package org.sporkfed.webhookagent.github.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import org.sporkfed.syncengine.model.PushEvent;
import org.springframework.stereotype.Component;

/**
 * Parser for GitHub push webhook payloads.
 */
@Component
public class GitHubWebhookParser {

    public static final String PUSH_EVENT = "push";

    /**
     * Parse a GitHub push payload.
     *
     * @param deliveryId The X-GitHub-Delivery header value
     * @param payload The raw JSON payload
     * @return Parsed push event; {@code headCommitId} is null when {@code head_commit} is null or missing
     */
    public PushEvent parsePush(String deliveryId, JsonNode payload) {
        String owner = null;
        String repoName = null;
        String defaultBranch = null;

        JsonNode repository = payload.path("repository");
        if (!repository.isMissingNode()) {
            repoName = repository.path("name").asText(null);
            defaultBranch = repository.path("default_branch").asText(null);

            JsonNode ownerNode = repository.path("owner");
            if (!ownerNode.isMissingNode()) {
                owner = ownerNode.hasNonNull("login")
                        ? ownerNode.path("login").asText()
                        : ownerNode.path("name").asText(null);
            }
        }

        String headCommitId = null;
        JsonNode headCommit = payload.path("head_commit");
        if (headCommit.isObject()) {
            headCommitId = headCommit.path("id").asText(null);
        }

        Long installationId = null;
        JsonNode installation = payload.path("installation");
        if (installation.hasNonNull("id")) {
            installationId = installation.path("id").asLong();
        }

        return new PushEvent(
                deliveryId,
                payload.path("ref").asText(null),
                payload.path("after").asText(null),
                defaultBranch,
                headCommitId,
                owner,
                repoName,
                installationId
        );
    }
}
