package com.tbmerch.backoffice.config;

import com.tbmerch.backoffice.integration.IntegrationException;
import com.tbmerch.backoffice.integration.storefront.StorefrontClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Storefront reachability. Reports UNKNOWN while no credentials are configured.
 */
@Component("storefrontHealth")
@RequiredArgsConstructor
@Slf4j
public class StorefrontHealthIndicator implements HealthIndicator {

    private final StorefrontClient storefrontClient;
    private final StorefrontProperties properties;

    @Override
    public Health health() {
        if (!storefrontClient.isConfigured()) {
            return Health.unknown().withDetail("configured", false).build();
        }
        try {
            Map<String, Object> shop = storefrontClient.shop();
            return Health.up()
                    .withDetail("store", properties.getStore())
                    .withDetail("name", String.valueOf(shop.get("name")))
                    .withDetail("apiVersion", properties.getApiVersion())
                    .build();
        } catch (IntegrationException e) {
            log.warn("Storefront health check failed: {}", e.getMessage());
            return Health.down()
                    .withDetail("store", properties.getStore())
                    .withException(e)
                    .build();
        }
    }
}
