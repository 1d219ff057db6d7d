package com.tbmerch.backoffice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "backoffice")
public class BackofficeProperties {

    private String version = "1.0.0";
    /** Public base URL of this service, used to build webhook callback addresses. */
    private String apiBaseUrl = "http://localhost:8001";
}
