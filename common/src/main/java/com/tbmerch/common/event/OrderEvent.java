package com.tbmerch.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Order lifecycle event published after an order is created or its status is overwritten.
 *
 * {@code previousStatus} is null for {@link KafkaTopics#ORDER_CREATED}.
 */
public record OrderEvent(

        @JsonProperty("event_id")
        UUID eventId,

        @JsonProperty("order_id")
        UUID orderId,

        @JsonProperty("order_number")
        String orderNumber,

        @JsonProperty("product_id")
        UUID productId,

        @JsonProperty("supplier_id")
        UUID supplierId,

        @JsonProperty("quantity")
        int quantity,

        @JsonProperty("total_amount")
        BigDecimal totalAmount,

        @JsonProperty("status")
        OrderStatus status,

        @JsonProperty("previous_status")
        OrderStatus previousStatus,

        @JsonProperty("tracking_number")
        String trackingNumber,

        @JsonProperty("created_at")
        Instant createdAt

) {
    public static OrderEvent created(UUID orderId, String orderNumber, UUID productId, UUID supplierId,
                                     int quantity, BigDecimal totalAmount, OrderStatus status) {
        return new OrderEvent(
                UUID.randomUUID(), orderId, orderNumber, productId, supplierId,
                quantity, totalAmount, status, null, null, Instant.now()
        );
    }

    public static OrderEvent statusChanged(UUID orderId, String orderNumber, UUID productId, UUID supplierId,
                                           int quantity, BigDecimal totalAmount,
                                           OrderStatus previousStatus, OrderStatus status,
                                           String trackingNumber) {
        return new OrderEvent(
                UUID.randomUUID(), orderId, orderNumber, productId, supplierId,
                quantity, totalAmount, status, previousStatus, trackingNumber, Instant.now()
        );
    }
}
