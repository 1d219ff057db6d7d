package com.tbmerch.backoffice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "encoding")
public class EncodingProperties {

    private String baseUrl = "https://api.zencoder.com/v2";
    private String clientId;
    private String clientSecret;
    /** Overlaid on hero videos when set. */
    private String watermarkUrl;

    public boolean isConfigured() {
        return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isBlank();
    }
}
