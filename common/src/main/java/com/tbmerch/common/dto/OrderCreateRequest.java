package com.tbmerch.common.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.Map;
import java.util.UUID;

/**
 * Client request to place an order for a single product.
 *
 * Carries no price: unit price and total are taken from the product at creation time.
 */
public record OrderCreateRequest(

        @JsonProperty("customer_name")
        @NotBlank
        String customerName,

        @JsonProperty("customer_email")
        @NotBlank @Email
        String customerEmail,

        @JsonProperty("customer_phone")
        String customerPhone,

        @JsonProperty("shipping_address")
        Map<String, Object> shippingAddress,

        @JsonProperty("product_id")
        @NotNull
        UUID productId,

        @JsonProperty("quantity")
        @NotNull @Positive
        Integer quantity,

        @JsonProperty("notes")
        String notes
) {}
