package com.tbmerch.backoffice.domain;

import com.tbmerch.backoffice.ingestion.OrderDraft;
import com.tbmerch.backoffice.service.OrderAttributor;
import com.tbmerch.common.event.OrderStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class OrderRepositoryTest {

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void sumTotalAmountByStatusIn_shouldOnlyCountGivenStatuses() {
        // Given
        UUID supplierId = UUID.randomUUID();
        orderRepository.save(order("ORD-00000001", supplierId, "60.00", OrderStatus.SHIPPED));
        orderRepository.save(order("ORD-00000002", supplierId, "40.50", OrderStatus.DELIVERED));
        orderRepository.save(order("ORD-00000003", supplierId, "99.00", OrderStatus.PENDING));

        // When
        BigDecimal revenue = orderRepository.sumTotalAmountByStatusIn(EnumSet.of(OrderStatus.SHIPPED, OrderStatus.DELIVERED));

        // Then
        assertEquals(0, new BigDecimal("100.50").compareTo(revenue));
    }

    @Test
    void sumTotalAmountByStatusIn_shouldBeZero_whenNothingMatches() {
        BigDecimal revenue = orderRepository.sumTotalAmountByStatusIn(EnumSet.of(OrderStatus.DELIVERED));

        assertEquals(0, BigDecimal.ZERO.compareTo(revenue));
    }

    @Test
    void revenueBySupplier_shouldGroupAttributedOrders() {
        // Given
        UUID cj = UUID.randomUUID();
        UUID dsers = UUID.randomUUID();
        orderRepository.save(order("ORD-00000011", cj, "20.00", OrderStatus.PENDING));
        orderRepository.save(order("ORD-00000012", cj, "40.00", OrderStatus.SHIPPED));
        orderRepository.save(order("ORD-00000013", dsers, "15.00", OrderStatus.PENDING));
        orderRepository.save(order("ORD-00000014", null, "999.00", OrderStatus.PENDING));

        // When
        List<SupplierRevenue> rows = orderRepository.revenueBySupplier();

        // Then
        assertEquals(2, rows.size());
        SupplierRevenue cjRow = rows.stream().filter(r -> r.supplierId().equals(cj)).findFirst().orElseThrow();
        assertEquals(2L, cjRow.orderCount());
        assertEquals(0, new BigDecimal("60.00").compareTo(cjRow.revenue()));
        assertEquals(30.0, cjRow.averageOrderValue(), 0.001);
    }

    @Test
    void shippingAddress_shouldSurviveRoundTripAsJson() {
        // Given
        Order saved = orderRepository.save(order("ORD-00000021", null, "10.00", OrderStatus.PENDING));
        entityManager.flush();
        entityManager.clear();

        // When
        Order reloaded = orderRepository.findById(saved.getId()).orElseThrow();

        // Then
        assertEquals(Map.of("address1", "1 Lightning Way", "city", "Tampa"), reloaded.getShippingAddress());
        assertNotNull(reloaded.getCreatedAt());
        assertTrue(orderRepository.existsByStorefrontOrderId("sf-ORD-00000021"));
        assertEquals(saved.getId(), orderRepository.findFirstByStorefrontOrderId("sf-ORD-00000021").orElseThrow().getId());
    }

    @Test
    void save_shouldKeepTotalEqualToUnitPriceTimesQuantity_whenImportedPriceHasSubCentDigits() {
        // Given
        OrderDraft draft = new OrderDraft("CJ-1001", "Jane Doe", null, null,
                Map.of("address1", "1 Lightning Way", "city", "Tampa"),
                "TB-CAP-01", "Lightning Cap", 3, new BigDecimal("19.995"), null);
        Supplier supplier = Supplier.builder().id(UUID.randomUUID()).build();
        Order saved = orderRepository.save(new OrderAttributor().attributeImported(draft, supplier, null));
        entityManager.flush();
        entityManager.clear();

        // When
        Order reloaded = orderRepository.findById(saved.getId()).orElseThrow();

        // Then
        assertEquals(0, new BigDecimal("20.00").compareTo(reloaded.getUnitPrice()));
        assertEquals(0, new BigDecimal("60.00").compareTo(reloaded.getTotalAmount()));
        assertEquals(0, reloaded.getUnitPrice().multiply(BigDecimal.valueOf(reloaded.getQuantity()))
                .compareTo(reloaded.getTotalAmount()));
    }

    private static Order order(String orderNumber, UUID supplierId, String total, OrderStatus status) {
        return Order.builder()
                .orderNumber(orderNumber)
                .customerName("Jane Doe")
                .shippingAddress(Map.of("address1", "1 Lightning Way", "city", "Tampa"))
                .supplierId(supplierId)
                .quantity(1)
                .unitPrice(new BigDecimal(total))
                .totalAmount(new BigDecimal(total))
                .status(status)
                .storefrontOrderId("sf-" + orderNumber)
                .build();
    }
}
