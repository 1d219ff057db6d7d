package com.tbmerch.common.event;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class OrderEventTest {

    @Test
    void created_shouldAssignEventIdAndTimestamp_withoutPreviousStatus() {
        UUID orderId = UUID.randomUUID();

        OrderEvent event = OrderEvent.created(orderId, "ORD-1A2B3C4D", UUID.randomUUID(), UUID.randomUUID(),
                3, new BigDecimal("60.00"), OrderStatus.PENDING);

        assertNotNull(event.eventId());
        assertNotNull(event.createdAt());
        assertEquals(orderId, event.orderId());
        assertEquals(OrderStatus.PENDING, event.status());
        assertNull(event.previousStatus());
        assertNull(event.trackingNumber());
    }

    @Test
    void statusChanged_shouldCarryBothStatusesAndTrackingNumber() {
        OrderEvent event = OrderEvent.statusChanged(UUID.randomUUID(), "ORD-1A2B3C4D", null, null,
                1, new BigDecimal("20.00"), OrderStatus.PROCESSING, OrderStatus.SHIPPED, "1Z999");

        assertEquals(OrderStatus.PROCESSING, event.previousStatus());
        assertEquals(OrderStatus.SHIPPED, event.status());
        assertEquals("1Z999", event.trackingNumber());
    }

    @Test
    void factoryMethods_shouldGenerateDistinctEventIds() {
        UUID orderId = UUID.randomUUID();
        OrderEvent first = OrderEvent.created(orderId, "ORD-1", null, null, 1, BigDecimal.ONE, OrderStatus.PENDING);
        OrderEvent second = OrderEvent.created(orderId, "ORD-1", null, null, 1, BigDecimal.ONE, OrderStatus.PENDING);

        assertNotEquals(first.eventId(), second.eventId());
    }
}
