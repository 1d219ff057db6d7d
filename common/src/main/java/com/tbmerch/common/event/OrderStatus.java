package com.tbmerch.common.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Order fulfilment status.
 *
 * Usual flow: pending → processing → shipped → delivered, or cancelled at any point.
 * The back-office does not enforce this flow; any value may overwrite any other.
 */
public enum OrderStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    SHIPPED("shipped"),
    DELIVERED("delivered"),
    CANCELLED("cancelled");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses the lowercase wire value ("shipped"). Upper-case constant names are accepted as well.
     *
     * @throws IllegalArgumentException for anything else
     */
    @JsonCreator
    public static OrderStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Order status is required");
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown order status: " + value));
    }
}
