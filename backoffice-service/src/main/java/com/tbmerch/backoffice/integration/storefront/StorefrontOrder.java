package com.tbmerch.backoffice.integration.storefront;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Order as sent by the storefront, both in webhook bodies and in order listings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorefrontOrder(
        @JsonProperty("id") Long id,
        @JsonProperty("name") String name,
        @JsonProperty("email") String email,
        @JsonProperty("phone") String phone,
        @JsonProperty("total_price") String totalPrice,
        @JsonProperty("financial_status") String financialStatus,
        @JsonProperty("fulfillment_status") String fulfillmentStatus,
        @JsonProperty("customer") Customer customer,
        @JsonProperty("shipping_address") Map<String, Object> shippingAddress,
        @JsonProperty("line_items") List<LineItem> lineItems,
        @JsonProperty("note") String note
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Customer(
            @JsonProperty("first_name") String firstName,
            @JsonProperty("last_name") String lastName,
            @JsonProperty("email") String email,
            @JsonProperty("phone") String phone
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LineItem(
            @JsonProperty("id") Long id,
            @JsonProperty("variant_id") Long variantId,
            @JsonProperty("sku") String sku,
            @JsonProperty("title") String title,
            @JsonProperty("quantity") Integer quantity,
            @JsonProperty("price") String price
    ) {
    }
}
