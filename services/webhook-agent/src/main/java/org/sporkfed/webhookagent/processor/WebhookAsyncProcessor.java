package org.sporkfed.webhookagent.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sporkfed.syncengine.model.PushEvent;
import org.sporkfed.syncengine.model.PushProcessingResult;
import org.sporkfed.syncengine.processor.PushEventProcessor;
import org.sporkfed.webhookagent.github.service.GitHubClientProvider;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs push synchronization off the HTTP request thread.
 */
@Service
public class WebhookAsyncProcessor {

    private static final Logger log = LoggerFactory.getLogger(WebhookAsyncProcessor.class);

    private final PushEventProcessor pushEventProcessor;
    private final GitHubClientProvider clientProvider;

    public WebhookAsyncProcessor(PushEventProcessor pushEventProcessor, GitHubClientProvider clientProvider) {
        this.pushEventProcessor = pushEventProcessor;
        this.clientProvider = clientProvider;
    }

    @Async("webhookExecutor")
    public void processPushAsync(PushEvent event) {
        try {
            PushProcessingResult result = pushEventProcessor.process(event, clientProvider);
            log.info("Push delivery {} for {}: {}",
                    event.deliveryId(), event.repositoryCoordinates().getFullName(), result.message());
        } catch (Exception e) {
            log.error("Failed to process push delivery {} for {}",
                    event.deliveryId(), event.repositoryCoordinates().getFullName(), e);
        }
    }
}
