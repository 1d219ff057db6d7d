package com.tbmerch.backoffice.service;

import com.tbmerch.backoffice.domain.Order;
import com.tbmerch.backoffice.domain.OrderRepository;
import com.tbmerch.backoffice.domain.Product;
import com.tbmerch.backoffice.domain.ProductRepository;
import com.tbmerch.backoffice.domain.Supplier;
import com.tbmerch.backoffice.domain.SupplierRepository;
import com.tbmerch.backoffice.kafka.OrderEventPublisher;
import com.tbmerch.common.dto.OrderCreateRequest;
import com.tbmerch.common.event.OrderEvent;
import com.tbmerch.common.event.OrderStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Order lifecycle. Every created order and every status change is published as an {@link OrderEvent}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final SupplierRepository supplierRepository;
    private final OrderAttributor orderAttributor;
    private final OrderEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    private Counter ordersCreatedCounter;
    private Counter statusChangedCounter;

    @PostConstruct
    void initMetrics() {
        ordersCreatedCounter = Counter.builder("orders.created.total")
                .description("Orders created through the API, imports and storefront")
                .register(meterRegistry);
        statusChangedCounter = Counter.builder("orders.status.changed.total")
                .description("Order status updates")
                .register(meterRegistry);
    }

    /**
     * Places an order for one product. Fails before anything is written when the product,
     * or the supplier it points at, no longer exists.
     */
    @Transactional
    public Order createOrder(OrderCreateRequest request) {
        Product product = productRepository.findById(request.productId())
                .orElseThrow(() -> new ProductNotFoundException(request.productId()));
        Supplier supplier = supplierRepository.findById(product.getSupplierId())
                .orElseThrow(() -> new SupplierNotFoundException(product.getSupplierId()));

        Order saved = orderRepository.save(orderAttributor.attribute(request, product, supplier));
        log.info("Order created | orderId={} | orderNumber={} | productId={} | supplierId={} | quantity={} | totalAmount={}",
                saved.getId(), saved.getOrderNumber(), saved.getProductId(), saved.getSupplierId(),
                saved.getQuantity(), saved.getTotalAmount());

        announceCreated(saved);
        return saved;
    }

    /**
     * Stores an order that was built elsewhere (supplier import, storefront) and announces it.
     */
    @Transactional
    public Order recordExternalOrder(Order order) {
        if (order.getOrderNumber() == null) {
            order.setOrderNumber(orderAttributor.nextOrderNumber());
        }
        Order saved = orderRepository.save(order);
        log.info("External order recorded | orderId={} | orderNumber={} | supplierOrderId={} | storefrontOrderId={}",
                saved.getId(), saved.getOrderNumber(), saved.getSupplierOrderId(), saved.getStorefrontOrderId());
        announceCreated(saved);
        return saved;
    }

    @Transactional(readOnly = true)
    public Order getOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    /** Newest first; {@code status} may be {@code null}. */
    @Transactional(readOnly = true)
    public List<Order> listOrders(OrderStatus status) {
        return status == null
                ? orderRepository.findAll(NEWEST_FIRST)
                : orderRepository.findByStatus(status, NEWEST_FIRST);
    }

    /**
     * Sets the status, from any status to any status. The tracking number is only replaced when given;
     * prices are never touched.
     */
    @Transactional
    public Order updateStatus(UUID orderId, OrderStatus status, String trackingNumber) {
        Order order = getOrder(orderId);
        OrderStatus previous = order.getStatus();

        order.setStatus(status);
        if (trackingNumber != null && !trackingNumber.isBlank()) {
            order.setTrackingNumber(trackingNumber);
        }
        Order saved = orderRepository.save(order);
        statusChangedCounter.increment();
        log.info("Order status updated | orderId={} | {} -> {} | trackingNumber={}",
                orderId, previous, status, saved.getTrackingNumber());

        eventPublisher.publishStatusChanged(OrderEvent.statusChanged(
                saved.getId(), saved.getOrderNumber(), saved.getProductId(), saved.getSupplierId(),
                saved.getQuantity(), saved.getTotalAmount(), previous, status, saved.getTrackingNumber()));
        return saved;
    }

    @Transactional
    public void deleteOrder(UUID orderId) {
        if (!orderRepository.existsById(orderId)) {
            throw new OrderNotFoundException(orderId);
        }
        orderRepository.deleteById(orderId);
        log.info("Order deleted | orderId={}", orderId);
    }

    private void announceCreated(Order saved) {
        ordersCreatedCounter.increment();
        eventPublisher.publishCreated(OrderEvent.created(
                saved.getId(), saved.getOrderNumber(), saved.getProductId(), saved.getSupplierId(),
                saved.getQuantity(), saved.getTotalAmount(), saved.getStatus()));
    }
}
