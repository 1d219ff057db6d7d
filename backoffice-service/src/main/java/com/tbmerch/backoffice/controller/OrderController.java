package com.tbmerch.backoffice.controller;

import com.tbmerch.backoffice.domain.Order;
import com.tbmerch.backoffice.service.OrderService;
import com.tbmerch.common.dto.OrderCreateRequest;
import com.tbmerch.common.event.OrderStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    /**
     * Places an order for one product. Price and supplier are taken from the product.
     */
    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(@Valid @RequestBody OrderCreateRequest request) {
        Order order = orderService.createOrder(request);
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(OrderResponse.from(order));
    }

    @GetMapping
    public ResponseEntity<List<OrderResponse>> listOrders(@RequestParam(name = "status", required = false) String status) {
        OrderStatus statusFilter = status == null || status.isBlank() ? null : OrderStatus.fromValue(status);
        return ResponseEntity.ok(orderService.listOrders(statusFilter).stream()
                .map(OrderResponse::from)
                .toList());
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable UUID orderId) {
        return ResponseEntity.ok(OrderResponse.from(orderService.getOrder(orderId)));
    }

    @PutMapping("/{orderId}/status")
    public ResponseEntity<OrderResponse> updateStatus(
            @PathVariable UUID orderId,
            @RequestParam("status") String status,
            @RequestParam(name = "tracking_number", required = false) String trackingNumber) {
        Order order = orderService.updateStatus(orderId, OrderStatus.fromValue(status), trackingNumber);
        return ResponseEntity.ok(OrderResponse.from(order));
    }

    @DeleteMapping("/{orderId}")
    public ResponseEntity<Void> deleteOrder(@PathVariable UUID orderId) {
        orderService.deleteOrder(orderId);
        return ResponseEntity.noContent().build();
    }

    public record OrderResponse(
            UUID id,
            String orderNumber,
            String customerName,
            String customerEmail,
            String customerPhone,
            Map<String, Object> shippingAddress,
            UUID productId,
            UUID supplierId,
            int quantity,
            BigDecimal unitPrice,
            BigDecimal totalAmount,
            OrderStatus status,
            String supplierOrderId,
            String storefrontOrderId,
            String trackingNumber,
            String notes,
            Instant createdAt,
            Instant updatedAt
    ) {
        public static OrderResponse from(Order order) {
            return new OrderResponse(
                    order.getId(),
                    order.getOrderNumber(),
                    order.getCustomerName(),
                    order.getCustomerEmail(),
                    order.getCustomerPhone(),
                    order.getShippingAddress(),
                    order.getProductId(),
                    order.getSupplierId(),
                    order.getQuantity(),
                    order.getUnitPrice(),
                    order.getTotalAmount(),
                    order.getStatus(),
                    order.getSupplierOrderId(),
                    order.getStorefrontOrderId(),
                    order.getTrackingNumber(),
                    order.getNotes(),
                    order.getCreatedAt(),
                    order.getUpdatedAt());
        }
    }
}
