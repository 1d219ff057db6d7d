package com.tbmerch.backoffice.integration.storefront;

import com.tbmerch.backoffice.config.StorefrontProperties;
import com.tbmerch.backoffice.domain.Order;
import com.tbmerch.backoffice.domain.Product;
import com.tbmerch.backoffice.integration.IntegrationException;
import com.tbmerch.backoffice.integration.storefront.StorefrontPayloads.FulfillmentWrite;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin client for the Shopify Admin REST API. Only the first page of any listing is read.
 * <p>
 * Every failure surfaces as {@link IntegrationException}.
 */
@Component
@Slf4j
public class StorefrontClient {

    static final String ACCESS_TOKEN_HEADER = "X-Shopify-Access-Token";

    private static final ParameterizedTypeReference<Map<String, List<StorefrontProduct>>> PRODUCTS =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Map<String, StorefrontProduct>> PRODUCT =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Map<String, List<StorefrontOrder>>> ORDERS =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Map<String, StorefrontOrder>> ORDER =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Map<String, List<Map<String, Object>>>> LOCATIONS =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Map<String, Map<String, Object>>> OBJECT =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Map<String, List<StorefrontWebhook>>> WEBHOOKS =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Map<String, StorefrontWebhook>> WEBHOOK =
            new ParameterizedTypeReference<>() {};

    private final StorefrontProperties properties;
    private final RestClient restClient;

    public StorefrontClient(RestClient.Builder restClientBuilder, StorefrontProperties properties) {
        this.properties = properties;
        this.restClient = restClientBuilder
                .baseUrl(properties.baseUrl())
                .defaultHeader(ACCESS_TOKEN_HEADER, properties.getAccessToken() == null ? "" : properties.getAccessToken())
                .build();
    }

    public boolean isConfigured() {
        return properties.isConfigured();
    }

    public List<StorefrontProduct> listProducts() {
        return call("list products", () -> {
            Map<String, List<StorefrontProduct>> body = restClient.get()
                    .uri("/products.json?limit={limit}", properties.getPageLimit())
                    .retrieve()
                    .body(PRODUCTS);
            return listOrEmpty(body, "products");
        });
    }

    public StorefrontProduct createProduct(Product product) {
        return call("create product " + product.getSku(), () -> required(restClient.post()
                .uri("/products.json")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("product", StorefrontPayloads.product(product, null, properties.getCatalog())))
                .retrieve()
                .body(PRODUCT), "product"));
    }

    public StorefrontProduct updateProduct(long remoteId, Product product) {
        return call("update product " + remoteId, () -> required(restClient.put()
                .uri("/products/{id}.json", remoteId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("product", StorefrontPayloads.product(product, remoteId, properties.getCatalog())))
                .retrieve()
                .body(PRODUCT), "product"));
    }

    public List<StorefrontOrder> listOrders(String status) {
        return call("list orders", () -> {
            Map<String, List<StorefrontOrder>> body = restClient.get()
                    .uri("/orders.json?status={status}&limit={limit}", status, properties.getPageLimit())
                    .retrieve()
                    .body(ORDERS);
            return listOrEmpty(body, "orders");
        });
    }

    public StorefrontOrder createOrder(Order order, long variantId) {
        return call("create order " + order.getOrderNumber(), () -> required(restClient.post()
                .uri("/orders.json")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("order", StorefrontPayloads.order(order, variantId)))
                .retrieve()
                .body(ORDER), "order"));
    }

    /** Id of the first location of the shop. */
    public long defaultLocationId() {
        return call("get locations", () -> {
            List<Map<String, Object>> locations = listOrEmpty(
                    restClient.get().uri("/locations.json").retrieve().body(LOCATIONS), "locations");
            if (locations.isEmpty() || !(locations.get(0).get("id") instanceof Number id)) {
                throw new IntegrationException("Storefront has no location to fulfil from");
            }
            return id.longValue();
        });
    }

    public Map<String, Object> fulfillOrder(String storefrontOrderId, String trackingNumber) {
        long locationId = defaultLocationId();
        return call("fulfil order " + storefrontOrderId, () -> required(restClient.post()
                .uri("/orders/{id}/fulfillments.json", storefrontOrderId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("fulfillment", new FulfillmentWrite(locationId, trackingNumber, true)))
                .retrieve()
                .body(OBJECT), "fulfillment"));
    }

    public List<StorefrontWebhook> listWebhooks() {
        return call("list webhooks", () -> listOrEmpty(
                restClient.get().uri("/webhooks.json").retrieve().body(WEBHOOKS), "webhooks"));
    }

    public StorefrontWebhook createWebhook(String topic, String address) {
        return call("create webhook " + topic, () -> required(restClient.post()
                .uri("/webhooks.json")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("webhook", StorefrontWebhook.subscription(topic, address)))
                .retrieve()
                .body(WEBHOOK), "webhook"));
    }

    public Map<String, Object> shop() {
        return call("get shop", () -> required(
                restClient.get().uri("/shop.json").retrieve().body(OBJECT), "shop"));
    }

    private <T> T call(String action, Supplier<T> request) {
        if (!properties.isConfigured()) {
            throw new IntegrationException("Storefront credentials are not configured");
        }
        try {
            return request.get();
        } catch (RestClientException e) {
            log.error("Storefront call failed | action={} | error={}", action, e.getMessage());
            throw new IntegrationException("Storefront " + action + " failed: " + e.getMessage(), e);
        }
    }

    private static <T> T required(Map<String, T> body, String key) {
        if (body == null || body.get(key) == null) {
            throw new IntegrationException("Storefront response has no '" + key + "'");
        }
        return body.get(key);
    }

    private static <T> List<T> listOrEmpty(Map<String, List<T>> body, String key) {
        if (body == null || body.get(key) == null) {
            return List.of();
        }
        return body.get(key);
    }
}
