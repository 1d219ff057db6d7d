package com.tbmerch.backoffice.controller;

import com.tbmerch.backoffice.integration.storefront.StorefrontSyncService;
import com.tbmerch.backoffice.integration.storefront.SyncReport;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * Storefront operations. Remote failures are reported in the body with status 200.
 */
@RestController
@RequestMapping("/api/storefront")
@RequiredArgsConstructor
public class StorefrontController {

    private final StorefrontSyncService syncService;

    @PostMapping("/sync/products")
    public ResponseEntity<SyncReport> syncProducts() {
        return ResponseEntity.ok(syncService.syncProducts());
    }

    @PostMapping("/sync/orders")
    public ResponseEntity<SyncReport> importOrders() {
        return ResponseEntity.ok(syncService.importOrders());
    }

    @PostMapping("/webhooks/setup")
    public ResponseEntity<Map<String, Object>> setupWebhooks() {
        return ResponseEntity.ok(syncService.setupWebhooks());
    }

    @PostMapping("/orders/{orderId}/fulfill")
    public ResponseEntity<Map<String, Object>> fulfillOrder(@PathVariable UUID orderId) {
        return ResponseEntity.ok(syncService.fulfillOrder(orderId));
    }

    @PostMapping("/orders/{orderId}/push")
    public ResponseEntity<Map<String, Object>> pushOrder(@PathVariable UUID orderId) {
        return ResponseEntity.ok(syncService.pushOrder(orderId));
    }
}
