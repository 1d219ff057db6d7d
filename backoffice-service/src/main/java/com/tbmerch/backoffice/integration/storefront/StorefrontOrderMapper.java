package com.tbmerch.backoffice.integration.storefront;

import com.tbmerch.backoffice.domain.Order;
import com.tbmerch.backoffice.domain.Product;
import com.tbmerch.backoffice.domain.ProductRepository;
import com.tbmerch.common.event.OrderStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * Maps storefront orders onto local orders. Prices are taken from the storefront as they are;
 * the product, and through it the supplier, is resolved from the first line item's SKU when possible.
 */
@Component
@RequiredArgsConstructor
public class StorefrontOrderMapper {

    private final ProductRepository productRepository;

    public Order toOrder(StorefrontOrder source, OrderStatus status) {
        StorefrontOrder.Customer customer = source.customer();
        String name = customer == null ? ""
                : ((nullToEmpty(customer.firstName()) + " " + nullToEmpty(customer.lastName())).trim());
        String email = source.email() != null ? source.email() : customer == null ? null : customer.email();
        String phone = source.phone() != null ? source.phone() : customer == null ? null : customer.phone();

        StorefrontOrder.LineItem line = firstLineItem(source.lineItems());
        int quantity = line == null || line.quantity() == null || line.quantity() <= 0 ? 1 : line.quantity();
        BigDecimal total = decimal(source.totalPrice());
        BigDecimal unitPrice = line != null && line.price() != null
                ? decimal(line.price())
                : total.divide(BigDecimal.valueOf(quantity), 2, RoundingMode.HALF_UP);

        Optional<Product> product = line == null || line.sku() == null || line.sku().isBlank()
                ? Optional.empty()
                : productRepository.findFirstBySku(line.sku());

        return Order.builder()
                .customerName(name.isEmpty() ? "Storefront customer" : name)
                .customerEmail(email)
                .customerPhone(phone)
                .shippingAddress(source.shippingAddress() == null ? new HashMap<>() : new HashMap<>(source.shippingAddress()))
                .productId(product.map(Product::getId).orElse(null))
                .supplierId(product.map(Product::getSupplierId).orElse(null))
                .quantity(quantity)
                .unitPrice(unitPrice)
                .totalAmount(total)
                .status(status)
                .storefrontOrderId(source.id() == null ? null : source.id().toString())
                .notes(source.name() == null ? source.note() : "Storefront order " + source.name())
                .build();
    }

    private static StorefrontOrder.LineItem firstLineItem(List<StorefrontOrder.LineItem> items) {
        return items == null || items.isEmpty() ? null : items.get(0);
    }

    private static BigDecimal decimal(String value) {
        if (value == null || value.isBlank()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(value.trim());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
