package com.tbmerch.backoffice.integration.storefront;

import com.tbmerch.backoffice.config.BackofficeProperties;
import com.tbmerch.backoffice.domain.Order;
import com.tbmerch.backoffice.domain.OrderRepository;
import com.tbmerch.backoffice.domain.Product;
import com.tbmerch.backoffice.domain.ProductRepository;
import com.tbmerch.backoffice.integration.IntegrationException;
import com.tbmerch.backoffice.service.OrderService;
import com.tbmerch.backoffice.service.ProductNotFoundException;
import com.tbmerch.common.event.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Pushes the catalogue to the storefront and pulls orders back. Failures never propagate:
 * they are logged and reported in the returned payload.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StorefrontSyncService {

    static final List<String> WEBHOOK_TOPICS = List.of(
            "orders/create", "orders/updated", "orders/paid", "orders/fulfilled",
            "products/create", "products/update");

    private final StorefrontClient storefrontClient;
    private final StorefrontOrderMapper orderMapper;
    private final ProductRepository productRepository;
    private final OrderRepository orderRepository;
    private final OrderService orderService;
    private final BackofficeProperties backofficeProperties;

    /**
     * Updates remote products whose first-variant SKU matches a local product, creates the rest.
     */
    public SyncReport syncProducts() {
        Map<String, Long> remoteIdsBySku = new HashMap<>();
        try {
            for (StorefrontProduct remote : storefrontClient.listProducts()) {
                if (remote.firstSku() != null && remote.id() != null) {
                    remoteIdsBySku.putIfAbsent(remote.firstSku(), remote.id());
                }
            }
        } catch (IntegrationException e) {
            return new SyncReport(0, 0, 0, List.of(e.getMessage()));
        }

        int created = 0;
        int updated = 0;
        List<String> errors = new ArrayList<>();
        for (Product product : productRepository.findAll()) {
            try {
                Long remoteId = remoteIdsBySku.get(product.getSku());
                if (remoteId != null) {
                    storefrontClient.updateProduct(remoteId, product);
                    updated++;
                } else {
                    storefrontClient.createProduct(product);
                    created++;
                }
            } catch (IntegrationException e) {
                errors.add("Error syncing " + product.getName() + ": " + e.getMessage());
            }
        }
        log.info("Storefront product sync finished | created={} | updated={} | errors={}", created, updated, errors.size());
        return new SyncReport(created, updated, 0, errors);
    }

    /** Stores storefront orders whose storefront id is not known locally yet. */
    public SyncReport importOrders() {
        List<StorefrontOrder> remoteOrders;
        try {
            remoteOrders = storefrontClient.listOrders("any");
        } catch (IntegrationException e) {
            return new SyncReport(0, 0, 0, List.of(e.getMessage()));
        }

        int created = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();
        for (StorefrontOrder remote : remoteOrders) {
            if (remote.id() == null || orderRepository.existsByStorefrontOrderId(remote.id().toString())) {
                skipped++;
                continue;
            }
            try {
                orderService.recordExternalOrder(orderMapper.toOrder(remote, statusOf(remote)));
                created++;
            } catch (RuntimeException e) {
                log.warn("Storefront order import failed | storefrontOrderId={} | error={}", remote.id(), e.getMessage());
                errors.add("Error importing order " + remote.name() + ": " + e.getMessage());
            }
        }
        log.info("Storefront order import finished | created={} | skipped={} | errors={}", created, skipped, errors.size());
        return new SyncReport(created, 0, skipped, errors);
    }

    /**
     * Subscribes the standard topics to {@code {api-base-url}/api/webhooks/shopify/{topic}},
     * skipping addresses that are already registered.
     */
    public Map<String, Object> setupWebhooks() {
        String base = backofficeProperties.getApiBaseUrl() + "/api/webhooks/shopify/";
        List<StorefrontWebhook> createdHooks = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        Set<String> existing;
        try {
            existing = storefrontClient.listWebhooks().stream()
                    .map(StorefrontWebhook::address)
                    .collect(Collectors.toSet());
        } catch (IntegrationException e) {
            return result(createdHooks, List.of(e.getMessage()));
        }

        for (String topic : WEBHOOK_TOPICS) {
            String address = base + topic;
            if (existing.contains(address)) {
                continue;
            }
            try {
                createdHooks.add(storefrontClient.createWebhook(topic, address));
            } catch (IntegrationException e) {
                errors.add("Error creating webhook " + topic + ": " + e.getMessage());
            }
        }
        log.info("Storefront webhooks set up | created={} | errors={}", createdHooks.size(), errors.size());
        return result(createdHooks, errors);
    }

    /**
     * Marks a storefront order as fulfilled with the local tracking number.
     *
     * @throws IllegalArgumentException when the order did not come from the storefront
     */
    public Map<String, Object> fulfillOrder(UUID orderId) {
        Order order = orderService.getOrder(orderId);
        if (order.getStorefrontOrderId() == null) {
            throw new IllegalArgumentException("Order " + order.getOrderNumber() + " was not placed through the storefront");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        try {
            result.put("fulfillment", storefrontClient.fulfillOrder(order.getStorefrontOrderId(), order.getTrackingNumber()));
            log.info("Storefront order fulfilled | orderId={} | storefrontOrderId={}", orderId, order.getStorefrontOrderId());
        } catch (IntegrationException e) {
            result.put("error", e.getMessage());
        }
        return result;
    }

    /**
     * Creates a local order on the storefront, using the variant whose SKU matches the order's product,
     * and remembers the storefront id.
     */
    public Map<String, Object> pushOrder(UUID orderId) {
        Order order = orderService.getOrder(orderId);
        if (order.getProductId() == null) {
            throw new IllegalArgumentException("Order " + order.getOrderNumber() + " has no product");
        }
        Product product = productRepository.findById(order.getProductId())
                .orElseThrow(() -> new ProductNotFoundException(order.getProductId()));

        Map<String, Object> result = new LinkedHashMap<>();
        try {
            Long variantId = storefrontClient.listProducts().stream()
                    .filter(p -> product.getSku().equals(p.firstSku()))
                    .map(p -> p.variants().get(0).id())
                    .findFirst()
                    .orElseThrow(() -> new IntegrationException("Product " + product.getSku() + " is not on the storefront"));
            StorefrontOrder created = storefrontClient.createOrder(order, variantId);
            order.setStorefrontOrderId(String.valueOf(created.id()));
            orderRepository.save(order);
            log.info("Order pushed to storefront | orderId={} | storefrontOrderId={}", orderId, created.id());
            result.put("storefront_order_id", order.getStorefrontOrderId());
        } catch (IntegrationException e) {
            result.put("error", e.getMessage());
        }
        return result;
    }

    static OrderStatus statusOf(StorefrontOrder remote) {
        if ("fulfilled".equals(remote.fulfillmentStatus())) {
            return OrderStatus.SHIPPED;
        }
        if ("paid".equals(remote.financialStatus())) {
            return OrderStatus.PROCESSING;
        }
        return OrderStatus.PENDING;
    }

    private static Map<String, Object> result(List<StorefrontWebhook> created, List<String> errors) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("created", created);
        result.put("errors", errors);
        return result;
    }
}
