package com.tbmerch.backoffice.integration.storefront;

import com.tbmerch.backoffice.config.StorefrontProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * Checks {@code X-Shopify-Hmac-Sha256}: base64 HMAC-SHA256 of the raw body under the webhook secret.
 * Every request passes while no secret is configured.
 */
@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    public static final String SIGNATURE_HEADER = "X-Shopify-Hmac-Sha256";
    private static final String ALGORITHM = "HmacSHA256";

    private final StorefrontProperties properties;

    public boolean isEnabled() {
        return properties.getWebhookSecret() != null && !properties.getWebhookSecret().isBlank();
    }

    public boolean verify(String body, String signature) {
        if (!isEnabled()) {
            return true;
        }
        if (signature == null || signature.isBlank()) {
            return false;
        }
        byte[] expected = sign(body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, signature.trim().getBytes(StandardCharsets.UTF_8));
    }

    String sign(String body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(properties.getWebhookSecret().getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return Base64.getEncoder().encodeToString(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }
}
