package com.tbmerch.backoffice.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ProductType {
    PHYSICAL("physical"),
    PRINT_ON_DEMAND("print_on_demand"),
    AFFILIATE("affiliate"),
    DIGITAL("digital");

    private final String value;

    ProductType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ProductType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown product type: " + value));
    }
}
