package com.tbmerch.backoffice.service;

import com.tbmerch.backoffice.domain.OrderRepository;
import com.tbmerch.backoffice.domain.ProductRepository;
import com.tbmerch.backoffice.domain.Supplier;
import com.tbmerch.backoffice.domain.SupplierRepository;
import com.tbmerch.backoffice.domain.SupplierRevenue;
import com.tbmerch.backoffice.domain.SupplierType;
import com.tbmerch.common.event.OrderStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalyticsServiceTest {

    @Mock
    private ProductRepository productRepository;
    @Mock
    private OrderRepository orderRepository;
    @Mock
    private SupplierRepository supplierRepository;

    @InjectMocks
    private AnalyticsService analyticsService;

    @Test
    void overview_shouldCountAndSumShippedAndDeliveredRevenue() {
        // Given
        when(productRepository.count()).thenReturn(12L);
        when(orderRepository.count()).thenReturn(9L);
        when(orderRepository.countByStatus(OrderStatus.PENDING)).thenReturn(4L);
        when(orderRepository.countByStatus(OrderStatus.PROCESSING)).thenReturn(2L);
        when(supplierRepository.count()).thenReturn(3L);
        when(supplierRepository.countByActiveTrue()).thenReturn(2L);
        when(orderRepository.sumTotalAmountByStatusIn(AnalyticsService.REVENUE_STATUSES))
                .thenReturn(new BigDecimal("310.00"));

        // When
        AnalyticsService.Overview overview = analyticsService.overview();

        // Then
        assertEquals(12L, overview.totalProducts());
        assertEquals(9L, overview.totalOrders());
        assertEquals(4L, overview.pendingOrders());
        assertEquals(2L, overview.processingOrders());
        assertEquals(3L, overview.totalSuppliers());
        assertEquals(2L, overview.activeSuppliers());
        assertEquals(new BigDecimal("310.00"), overview.totalRevenue());
    }

    @Test
    void supplierPerformance_shouldSortByRevenue_andKeepDeletedSuppliersUnnamed() {
        // Given
        UUID cj = UUID.randomUUID();
        UUID gone = UUID.randomUUID();
        when(orderRepository.revenueBySupplier()).thenReturn(List.of(
                new SupplierRevenue(cj, 2L, new BigDecimal("60.00"), 30.0),
                new SupplierRevenue(gone, 3L, new BigDecimal("100.00"), 33.333333)));
        when(supplierRepository.findAllById(anyList())).thenReturn(List.of(
                Supplier.builder().id(cj).name("Cj Dropshipping").type(SupplierType.CJ_DROPSHIPPING).build()));

        // When
        List<AnalyticsService.SupplierPerformance> rows = analyticsService.supplierPerformance();

        // Then
        assertEquals(2, rows.size());
        assertEquals(gone, rows.get(0).supplierId());
        assertNull(rows.get(0).supplierName());
        assertEquals(new BigDecimal("33.33"), rows.get(0).averageOrderValue());
        assertEquals("Cj Dropshipping", rows.get(1).supplierName());
        assertEquals("cj_dropshipping", rows.get(1).supplierType());
        assertEquals(new BigDecimal("30.00"), rows.get(1).averageOrderValue());
    }
}
