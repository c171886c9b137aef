package org.sporkfed.webhookagent.webhookhandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Factory for obtaining the WebhookHandler of a GitHub event type.
 */
@Component
public class WebhookHandlerFactory {

    private static final Logger log = LoggerFactory.getLogger(WebhookHandlerFactory.class);

    private final List<WebhookHandler> handlers;

    public WebhookHandlerFactory(List<WebhookHandler> handlers) {
        this.handlers = List.copyOf(handlers);
        log.info("Registered {} webhook handlers", handlers.size());
    }

    /**
     * @return the first handler supporting {@code eventType}, or empty if the event is not handled
     */
    public Optional<WebhookHandler> getHandler(String eventType) {
        if (eventType == null) {
            return Optional.empty();
        }
        return handlers.stream()
                .filter(h -> h.supportsEvent(eventType))
                .findFirst();
    }
}
