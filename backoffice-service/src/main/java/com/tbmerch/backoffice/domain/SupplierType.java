package com.tbmerch.backoffice.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Supplier category. Decides which field mapping applies when a supplier export is imported.
 */
public enum SupplierType {
    CJ_DROPSHIPPING("cj_dropshipping"),
    DSERS("dsers"),
    AUTODS("autods"),
    PRINTFUL("printful"),
    PRINTIFY("printify"),
    GELATO("gelato"),
    PIETRA("pietra"),
    IMPACT_AFFILIATE("impact_affiliate"),
    DIRECT("direct");

    private final String slug;

    SupplierType(String slug) {
        this.slug = slug;
    }

    @JsonValue
    public String slug() {
        return slug;
    }

    /**
     * Name given to a supplier that is created implicitly during an import,
     * e.g. {@code cj_dropshipping} → {@code Cj Dropshipping}.
     */
    public String humanizedName() {
        return humanize(slug);
    }

    public static Optional<SupplierType> fromSlug(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.slug.equalsIgnoreCase(normalized) || t.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonCreator
    public static SupplierType of(String value) {
        return fromSlug(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown supplier type: " + value));
    }

    /**
     * Underscores and hyphens become spaces, every word is capitalised and the rest lower-cased.
     */
    public static String humanize(String slug) {
        StringBuilder name = new StringBuilder();
        for (String word : slug.trim().split("[_\\-\\s]+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (name.length() > 0) {
                name.append(' ');
            }
            name.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return name.toString();
    }
}
