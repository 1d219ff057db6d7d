package com.tbmerch.backoffice.integration.storefront;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StorefrontWebhook(
        @JsonProperty("id") Long id,
        @JsonProperty("topic") String topic,
        @JsonProperty("address") String address,
        @JsonProperty("format") String format
) {

    public static StorefrontWebhook subscription(String topic, String address) {
        return new StorefrontWebhook(null, topic, address, "json");
    }
}
