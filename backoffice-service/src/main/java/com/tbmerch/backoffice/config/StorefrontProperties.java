package com.tbmerch.backoffice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection and catalogue settings for the Shopify Admin API.
 */
@Data
@ConfigurationProperties(prefix = "storefront")
public class StorefrontProperties {

    /** Shop domain, e.g. {@code my-shop.myshopify.com}. */
    private String store;
    private String accessToken;
    private String apiVersion = "2024-01";
    /** Shared secret for {@code X-Shopify-Hmac-Sha256}; verification is off while empty. */
    private String webhookSecret;
    private int pageLimit = 250;

    private Catalog catalog = new Catalog();

    @Data
    public static class Catalog {
        private String vendor = "TampaBay Merch";
        private String defaultProductType = "Sports Merchandise";
        private String metafieldNamespace = "tampabay_merch";
    }

    public boolean isConfigured() {
        return store != null && !store.isBlank() && accessToken != null && !accessToken.isBlank();
    }

    public String baseUrl() {
        return "https://" + store + "/admin/api/" + apiVersion;
    }
}
