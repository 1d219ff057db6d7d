package com.tbmerch.backoffice.integration.storefront;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorefrontProduct(
        @JsonProperty("id") Long id,
        @JsonProperty("title") String title,
        @JsonProperty("product_type") String productType,
        @JsonProperty("status") String status,
        @JsonProperty("variants") List<Variant> variants
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Variant(
            @JsonProperty("id") Long id,
            @JsonProperty("sku") String sku,
            @JsonProperty("price") String price,
            @JsonProperty("inventory_quantity") Integer inventoryQuantity
    ) {
    }

    /** SKU of the first variant, which is how local products are matched. */
    public String firstSku() {
        if (variants == null || variants.isEmpty()) {
            return null;
        }
        return variants.get(0).sku();
    }
}
