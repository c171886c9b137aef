package org.sporkfed.webhookagent.webhookhandler;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;

/**
 * Interface for handling GitHub webhook events.
 */
public interface WebhookHandler {

    /**
     * Check if this handler supports the given event type.
     *
     * @param eventType The X-GitHub-Event header value
     * @return true if this handler can process the event
     */
    boolean supportsEvent(String eventType);

    /**
     * Process a webhook payload.
     *
     * @param deliveryId The X-GitHub-Delivery header value
     * @param payload The parsed JSON payload
     * @return Processing result
     */
    WebhookResult handle(String deliveryId, JsonNode payload);

    /**
     * Result of webhook processing.
     */
    record WebhookResult(
        String status,
        String message,
        Map<String, Object> data
    ) {
        public static WebhookResult ignored(String message) {
            return new WebhookResult("ignored", message, Map.of());
        }

        public static WebhookResult queued(String message, Map<String, Object> data) {
            return new WebhookResult("queued", message, data);
        }

        public ResponseEntity<Map<String, Object>> toResponseEntity() {
            Map<String, Object> body = new HashMap<>(data);
            body.put("status", status);
            body.put("message", message);

            if ("queued".equals(status)) {
                return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
            }
            return ResponseEntity.ok(body);
        }
    }
}
