package com.tbmerch.backoffice.integration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tbmerch.backoffice.domain.Order;
import com.tbmerch.backoffice.domain.OrderRepository;
import com.tbmerch.backoffice.domain.WebhookEvent;
import com.tbmerch.backoffice.domain.WebhookEventRepository;
import com.tbmerch.backoffice.integration.storefront.StorefrontOrder;
import com.tbmerch.backoffice.integration.storefront.StorefrontOrderMapper;
import com.tbmerch.backoffice.integration.storefront.WebhookSignatureException;
import com.tbmerch.backoffice.integration.storefront.WebhookSignatureVerifier;
import com.tbmerch.backoffice.service.OrderService;
import com.tbmerch.common.event.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Receives storefront and encoding callbacks. Every accepted body is stored verbatim;
 * new and paid storefront orders additionally become local orders.
 * <p>
 * Deliveries are not de-duplicated: a repeated {@code orders/create} creates another order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookService {

    static final String ORDERS_CREATE = "orders/create";
    static final String ORDERS_PAID = "orders/paid";
    static final String JOB_COMPLETE = "job_complete";

    private final WebhookEventRepository webhookEventRepository;
    private final WebhookSignatureVerifier signatureVerifier;
    private final StorefrontOrderMapper orderMapper;
    private final OrderRepository orderRepository;
    private final OrderService orderService;
    private final ObjectMapper objectMapper;

    /**
     * @throws WebhookSignatureException when signature checking is enabled and the signature does not match
     */
    public Map<String, Object> handleStorefrontEvent(String topic, String body, String signature) {
        if (!signatureVerifier.verify(body, signature)) {
            log.warn("Storefront webhook rejected | topic={} | reason=bad signature", topic);
            throw new WebhookSignatureException(topic);
        }
        WebhookEvent event = store(WebhookEvent.SOURCE_STOREFRONT, topic, body);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "received");
        result.put("event_id", event.getId());
        if (!ORDERS_CREATE.equals(topic) && !ORDERS_PAID.equals(topic)) {
            return result;
        }

        try {
            StorefrontOrder remote = objectMapper.readValue(body, StorefrontOrder.class);
            Order order = ORDERS_PAID.equals(topic) ? markPaid(remote) : created(remote);
            result.put("order_id", order.getId());
            result.put("order_number", order.getOrderNumber());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Storefront webhook not mapped | topic={} | eventId={} | error={}", topic, event.getId(), e.getMessage());
            result.put("error", e.getMessage());
        }
        return result;
    }

    public Map<String, Object> handleEncodingEvent(String body) {
        WebhookEvent event = store(WebhookEvent.SOURCE_ENCODING, JOB_COMPLETE, body);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "received");
        result.put("event_id", event.getId());
        return result;
    }

    private Order created(StorefrontOrder remote) {
        return orderService.recordExternalOrder(orderMapper.toOrder(remote, OrderStatus.PENDING));
    }

    /** An order already known locally moves to processing; an unknown one is recorded as processing. */
    private Order markPaid(StorefrontOrder remote) {
        Optional<Order> existing = remote.id() == null ? Optional.empty()
                : orderRepository.findFirstByStorefrontOrderId(remote.id().toString());
        if (existing.isPresent()) {
            return orderService.updateStatus(existing.get().getId(), OrderStatus.PROCESSING, null);
        }
        return orderService.recordExternalOrder(orderMapper.toOrder(remote, OrderStatus.PROCESSING));
    }

    private WebhookEvent store(String source, String topic, String body) {
        WebhookEvent saved = webhookEventRepository.save(WebhookEvent.builder()
                .source(source)
                .topic(topic)
                .payload(body)
                .build());
        log.info("Webhook received | source={} | topic={} | eventId={} | bytes={}",
                source, topic, saved.getId(), body == null ? 0 : body.length());
        return saved;
    }
}
