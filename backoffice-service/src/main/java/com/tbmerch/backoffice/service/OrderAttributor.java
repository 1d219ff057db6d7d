package com.tbmerch.backoffice.service;

import com.tbmerch.backoffice.domain.Order;
import com.tbmerch.backoffice.domain.Product;
import com.tbmerch.backoffice.domain.Supplier;
import com.tbmerch.backoffice.ingestion.OrderDraft;
import com.tbmerch.common.dto.OrderCreateRequest;
import com.tbmerch.common.event.OrderStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Locale;
import java.util.UUID;

/**
 * Builds new orders: price and supplier come from the product, total is unit price × quantity,
 * status starts at {@link OrderStatus#PENDING}.
 */
@Component
public class OrderAttributor {

    public Order attribute(OrderCreateRequest request, Product product, Supplier supplier) {
        BigDecimal unitPrice = cents(product.getPrice());
        return Order.builder()
                .orderNumber(nextOrderNumber())
                .customerName(request.customerName())
                .customerEmail(request.customerEmail())
                .customerPhone(request.customerPhone())
                .shippingAddress(request.shippingAddress() == null
                        ? new HashMap<>() : new HashMap<>(request.shippingAddress()))
                .productId(product.getId())
                .supplierId(supplier.getId())
                .quantity(request.quantity())
                .unitPrice(unitPrice)
                .totalAmount(total(unitPrice, request.quantity()))
                .status(OrderStatus.PENDING)
                .notes(request.notes())
                .build();
    }

    /**
     * Imported rows keep their own price when they carry one; otherwise the matched product's price,
     * otherwise zero. {@code product} may be {@code null}.
     */
    public Order attributeImported(OrderDraft draft, Supplier supplier, Product product) {
        BigDecimal unitPrice = cents(draft.unitPrice() != null ? draft.unitPrice()
                : product != null ? product.getPrice()
                : BigDecimal.ZERO);
        return Order.builder()
                .orderNumber(nextOrderNumber())
                .customerName(draft.customerName())
                .customerEmail(draft.customerEmail())
                .customerPhone(draft.customerPhone())
                .shippingAddress(draft.shippingAddress())
                .productId(product == null ? null : product.getId())
                .supplierId(supplier.getId())
                .quantity(draft.quantity())
                .unitPrice(unitPrice)
                .totalAmount(total(unitPrice, draft.quantity()))
                .status(OrderStatus.PENDING)
                .supplierOrderId(draft.supplierOrderId())
                .notes(draft.notes())
                .build();
    }

    /** {@code ORD-} followed by 8 upper-case hex characters. */
    public String nextOrderNumber() {
        return "ORD-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
    }

    static BigDecimal total(BigDecimal unitPrice, int quantity) {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    /** Unit prices carry two decimals, the scale they are stored with. */
    static BigDecimal cents(BigDecimal price) {
        return price.setScale(2, RoundingMode.HALF_UP);
    }
}
