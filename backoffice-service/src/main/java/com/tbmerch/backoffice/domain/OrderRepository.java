package com.tbmerch.backoffice.domain;

import com.tbmerch.common.event.OrderStatus;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface OrderRepository extends JpaRepository<Order, UUID> {

    List<Order> findByStatus(OrderStatus status, Sort sort);

    long countByStatus(OrderStatus status);

    boolean existsByStorefrontOrderId(String storefrontOrderId);

    Optional<Order> findFirstByStorefrontOrderId(String storefrontOrderId);

    @Query("select coalesce(sum(o.totalAmount), 0) from CustomerOrder o where o.status in :statuses")
    BigDecimal sumTotalAmountByStatusIn(@Param("statuses") Collection<OrderStatus> statuses);

    @Query("""
            select new com.tbmerch.backoffice.domain.SupplierRevenue(
                o.supplierId, count(o), sum(o.totalAmount), avg(o.totalAmount))
            from CustomerOrder o
            where o.supplierId is not null
            group by o.supplierId
            """)
    List<SupplierRevenue> revenueBySupplier();
}
