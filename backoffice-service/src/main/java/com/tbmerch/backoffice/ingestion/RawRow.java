package com.tbmerch.backoffice.ingestion;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;

/**
 * One row of a supplier export, keyed by the supplier's own column names.
 * Values may arrive as JSON numbers or as strings (CSV); the accessors coerce both.
 */
public final class RawRow {

    private final Map<String, ?> values;

    public RawRow(Map<String, ?> values) {
        this.values = values == null ? Collections.emptyMap() : values;
    }

    /** Trimmed text value, or {@code null} when the column is missing or blank. */
    public String text(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    public String text(String key, String defaultValue) {
        String text = text(key);
        return text == null ? defaultValue : text;
    }

    public String requiredText(String key) {
        String text = text(key);
        if (text == null) {
            throw new RowMappingException("Missing required field '" + key + "'");
        }
        return text;
    }

    public BigDecimal decimal(String key, BigDecimal defaultValue) {
        Object value = values.get(key);
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        String text = text(key);
        if (text == null) {
            return defaultValue;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new RowMappingException("Field '" + key + "' is not a number: " + text);
        }
    }

    public int integer(String key, int defaultValue) {
        BigDecimal decimal = decimal(key, null);
        if (decimal == null) {
            return defaultValue;
        }
        try {
            return decimal.intValueExact();
        } catch (ArithmeticException e) {
            throw new RowMappingException("Field '" + key + "' is not a whole number: " + decimal.toPlainString());
        }
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
