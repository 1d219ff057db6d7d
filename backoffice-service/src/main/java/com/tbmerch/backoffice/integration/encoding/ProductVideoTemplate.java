package com.tbmerch.backoffice.integration.encoding;

import java.util.Arrays;

public enum ProductVideoTemplate {
    SPORTS("sports", 10),
    PREMIUM("premium", 15);

    private final String value;
    private final int durationSeconds;

    ProductVideoTemplate(String value, int durationSeconds) {
        this.value = value;
        this.durationSeconds = durationSeconds;
    }

    public String value() {
        return value;
    }

    public int durationSeconds() {
        return durationSeconds;
    }

    /** Unknown or missing names fall back to {@link #SPORTS}. */
    public static ProductVideoTemplate fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value))
                .findFirst()
                .orElse(SPORTS);
    }
}
