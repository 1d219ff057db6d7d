package com.tbmerch.backoffice.service;

import com.tbmerch.backoffice.domain.OrderRepository;
import com.tbmerch.backoffice.domain.ProductRepository;
import com.tbmerch.backoffice.domain.Supplier;
import com.tbmerch.backoffice.domain.SupplierRepository;
import com.tbmerch.backoffice.domain.SupplierRevenue;
import com.tbmerch.common.event.OrderStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class AnalyticsService {

    /** Revenue only counts orders that have left the warehouse. */
    static final List<OrderStatus> REVENUE_STATUSES = List.of(OrderStatus.SHIPPED, OrderStatus.DELIVERED);

    private final ProductRepository productRepository;
    private final OrderRepository orderRepository;
    private final SupplierRepository supplierRepository;

    public record Overview(long totalProducts, long totalOrders, long pendingOrders, long processingOrders,
                           long totalSuppliers, long activeSuppliers, BigDecimal totalRevenue) {
    }

    public record SupplierPerformance(UUID supplierId, String supplierName, String supplierType,
                                      long orderCount, BigDecimal revenue, BigDecimal averageOrderValue) {
    }

    @Transactional(readOnly = true)
    public Overview overview() {
        BigDecimal revenue = orderRepository.sumTotalAmountByStatusIn(REVENUE_STATUSES);
        return new Overview(
                productRepository.count(),
                orderRepository.count(),
                orderRepository.countByStatus(OrderStatus.PENDING),
                orderRepository.countByStatus(OrderStatus.PROCESSING),
                supplierRepository.count(),
                supplierRepository.countByActiveTrue(),
                revenue == null ? BigDecimal.ZERO : revenue);
    }

    /**
     * Order count, revenue and average order value per supplier over all orders, highest revenue first.
     * Suppliers that have since been deleted are still listed, without a name.
     */
    @Transactional(readOnly = true)
    public List<SupplierPerformance> supplierPerformance() {
        List<SupplierRevenue> rows = orderRepository.revenueBySupplier();
        Map<UUID, Supplier> suppliers = supplierRepository
                .findAllById(rows.stream().map(SupplierRevenue::supplierId).toList())
                .stream()
                .collect(Collectors.toMap(Supplier::getId, Function.identity()));

        return rows.stream()
                .map(row -> {
                    Supplier supplier = suppliers.get(row.supplierId());
                    return new SupplierPerformance(
                            row.supplierId(),
                            supplier == null ? null : supplier.getName(),
                            supplier == null ? null : supplier.getType().slug(),
                            row.orderCount(),
                            row.revenue(),
                            row.averageOrderValue() == null ? BigDecimal.ZERO
                                    : BigDecimal.valueOf(row.averageOrderValue()).setScale(2, RoundingMode.HALF_UP));
                })
                .sorted(Comparator.comparing(SupplierPerformance::revenue).reversed())
                .toList();
    }
}
