package com.tbmerch.backoffice.service;

import com.tbmerch.backoffice.domain.ProductStatus;
import com.tbmerch.backoffice.domain.ProductType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ProductRequest(
        @NotBlank(message = "name is required") String name,
        String description,
        @NotNull(message = "price is required") @PositiveOrZero BigDecimal price,
        @PositiveOrZero BigDecimal cost,
        @NotBlank(message = "sku is required") String sku,
        @NotNull(message = "supplier_id is required") UUID supplierId,
        String supplierProductId,
        String supplierVariantId,
        String imageUrl,
        String category,
        List<String> tags,
        ProductType productType,
        ProductStatus status,
        @PositiveOrZero Integer stockQuantity,
        Double weight,
        Map<String, Object> dimensions,
        String affiliateUrl,
        Double commissionRate
) {
}
