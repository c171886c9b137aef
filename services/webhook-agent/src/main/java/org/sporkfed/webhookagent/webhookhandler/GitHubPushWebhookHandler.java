package org.sporkfed.webhookagent.webhookhandler;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sporkfed.syncengine.model.PushEvent;
import org.sporkfed.webhookagent.github.webhook.GitHubWebhookParser;
import org.sporkfed.webhookagent.processor.WebhookAsyncProcessor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Queues GitHub push events for synchronization. Branch and head-commit filtering happens in the
 * engine, so every well-formed push is accepted here.
 */
@Component
public class GitHubPushWebhookHandler implements WebhookHandler {

    private static final Logger log = LoggerFactory.getLogger(GitHubPushWebhookHandler.class);

    private final GitHubWebhookParser parser;
    private final WebhookAsyncProcessor asyncProcessor;

    public GitHubPushWebhookHandler(GitHubWebhookParser parser, WebhookAsyncProcessor asyncProcessor) {
        this.parser = parser;
        this.asyncProcessor = asyncProcessor;
    }

    @Override
    public boolean supportsEvent(String eventType) {
        return GitHubWebhookParser.PUSH_EVENT.equals(eventType);
    }

    @Override
    public WebhookResult handle(String deliveryId, JsonNode payload) {
        PushEvent event = parser.parsePush(deliveryId, payload);

        if (event.owner() == null || event.repository() == null) {
            log.warn("Push delivery {} has no repository, ignoring", deliveryId);
            return WebhookResult.ignored("Payload has no repository");
        }

        log.info("Queueing push to {} on {} (delivery {})",
                event.repositoryCoordinates().getFullName(), event.ref(), deliveryId);
        asyncProcessor.processPushAsync(event);

        Map<String, Object> data = new HashMap<>();
        data.put("repository", event.repositoryCoordinates().getFullName());
        data.put("ref", event.ref());
        return WebhookResult.queued("Push event queued for synchronization", data);
    }
}
