package org.sporkfed.webhookagent.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sporkfed.webhookagent.github.webhook.WebhookSignatureValidator;
import org.sporkfed.webhookagent.webhookhandler.WebhookHandler;
import org.sporkfed.webhookagent.webhookhandler.WebhookHandlerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Receives GitHub webhook deliveries and routes them to the handler of their event type.
 *
 * Webhook URL: /api/webhooks/github
 */
@RestController
@RequestMapping("/api/webhooks")
public class GitHubWebhookController {

    private static final Logger log = LoggerFactory.getLogger(GitHubWebhookController.class);
    private static final String PING_EVENT = "ping";

    private final ObjectMapper objectMapper;
    private final WebhookSignatureValidator signatureValidator;
    private final WebhookHandlerFactory webhookHandlerFactory;

    public GitHubWebhookController(
            ObjectMapper objectMapper,
            WebhookSignatureValidator signatureValidator,
            WebhookHandlerFactory webhookHandlerFactory
    ) {
        this.objectMapper = objectMapper;
        this.signatureValidator = signatureValidator;
        this.webhookHandlerFactory = webhookHandlerFactory;
    }

    @PostMapping("/github")
    public ResponseEntity<?> handleWebhook(
            @RequestHeader(value = "X-GitHub-Event", required = false) String eventType,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) String deliveryId,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestBody String body
    ) {
        log.info("Received GitHub webhook: eventType={}, delivery={}", eventType, deliveryId);

        if (!signatureValidator.isValid(signature, body)) {
            log.warn("Invalid signature for GitHub delivery {}", deliveryId);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "invalid_signature", "message", "Webhook signature does not match"));
        }

        if (PING_EVENT.equals(eventType)) {
            return ResponseEntity.ok(Map.of("status", "pong", "message", "Webhook is configured"));
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON in GitHub delivery {}: {}", deliveryId, e.getOriginalMessage());
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "invalid_payload", "message", "Request body is not valid JSON"));
        }
        if (payload == null || !payload.isObject()) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "invalid_payload", "message", "Request body must be a JSON object"));
        }

        Optional<WebhookHandler> handler = webhookHandlerFactory.getHandler(eventType);
        if (handler.isEmpty()) {
            log.info("No handler for GitHub event {}, ignoring", eventType);
            return ResponseEntity.ok(Map.of("status", "ignored",
                    "message", "Event type not supported: " + eventType));
        }

        try {
            return handler.get().handle(deliveryId, payload).toResponseEntity();
        } catch (Exception e) {
            log.error("Error processing GitHub delivery {}", deliveryId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "processing_error", "message", String.valueOf(e.getMessage())));
        }
    }
}
