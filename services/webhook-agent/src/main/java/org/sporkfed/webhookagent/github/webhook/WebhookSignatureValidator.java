package org.sporkfed.webhookagent.github.webhook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sporkfed.webhookagent.config.SporkfedProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

/**
 * Verifies the {@code X-Hub-Signature-256} header of GitHub deliveries. Verification is skipped
 * when no webhook secret is configured.
 */
@Component
public class WebhookSignatureValidator {

    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureValidator.class);
    private static final String SIGNATURE_PREFIX = "sha256=";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final String secret;

    public WebhookSignatureValidator(SporkfedProperties properties) {
        this(properties.getGithub().getWebhookSecret());
    }

    WebhookSignatureValidator(String secret) {
        this.secret = secret;
    }

    public boolean isEnabled() {
        return secret != null && !secret.isBlank();
    }

    public boolean isValid(String signatureHeader, String payload) {
        if (!isEnabled()) {
            log.warn("Webhook secret not configured, skipping signature verification. "
                    + "Set GITHUB_WEBHOOK_SECRET for production security.");
            return true;
        }
        if (signatureHeader == null || !signatureHeader.startsWith(SIGNATURE_PREFIX)) {
            log.warn("Missing or malformed GitHub webhook signature header");
            return false;
        }
        String expectedSignature = signatureHeader.substring(SIGNATURE_PREFIX.length());

        String actualSignature;
        try {
            actualSignature = sign(secret, payload);
        } catch (GeneralSecurityException e) {
            log.error("Failed to verify GitHub webhook signature", e);
            return false;
        }

        return MessageDigest.isEqual(
                expectedSignature.getBytes(StandardCharsets.UTF_8),
                actualSignature.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Hex encoded HMAC-SHA256 of {@code payload}.
     */
    static String sign(String secret, String payload) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
        byte[] hash = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));

        StringBuilder hexString = new StringBuilder();
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
