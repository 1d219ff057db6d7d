package com.tbmerch.backoffice.controller;

import com.tbmerch.backoffice.integration.WebhookService;
import com.tbmerch.backoffice.integration.storefront.WebhookSignatureVerifier;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Callbacks from the storefront and the encoding service. Bodies are taken raw so they can be
 * signature-checked and stored exactly as received.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookService webhookService;

    @PostMapping("/shopify/{resource}/{event}")
    public ResponseEntity<Map<String, Object>> storefrontEvent(
            @PathVariable String resource,
            @PathVariable String event,
            @RequestHeader(name = WebhookSignatureVerifier.SIGNATURE_HEADER, required = false) String signature,
            @RequestBody(required = false) String body) {
        return ResponseEntity.ok(webhookService.handleStorefrontEvent(resource + "/" + event, body, signature));
    }

    @PostMapping("/zencoder/job_complete")
    public ResponseEntity<Map<String, Object>> encodingJobComplete(@RequestBody(required = false) String body) {
        return ResponseEntity.ok(webhookService.handleEncodingEvent(body));
    }
}
