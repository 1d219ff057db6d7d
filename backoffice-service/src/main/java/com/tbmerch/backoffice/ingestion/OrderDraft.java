package com.tbmerch.backoffice.ingestion;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Order fields recovered from a supplier export row, before attribution to a product.
 * {@code unitPrice} is {@code null} when the export carries no price.
 */
public record OrderDraft(
        String supplierOrderId,
        String customerName,
        String customerEmail,
        String customerPhone,
        Map<String, Object> shippingAddress,
        String sku,
        String productName,
        int quantity,
        BigDecimal unitPrice,
        String notes
) {
}
