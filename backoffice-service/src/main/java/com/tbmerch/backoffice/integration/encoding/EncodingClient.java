package com.tbmerch.backoffice.integration.encoding;

import com.tbmerch.backoffice.config.BackofficeProperties;
import com.tbmerch.backoffice.config.EncodingProperties;
import com.tbmerch.backoffice.integration.IntegrationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the encoding service. A fresh client-credentials token is requested for every call.
 */
@Component
@Slf4j
public class EncodingClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    static final String NOTIFICATION_PATH = "/api/webhooks/zencoder/job_complete";

    private final EncodingProperties properties;
    private final String notificationUrl;
    private final RestClient restClient;

    public EncodingClient(RestClient.Builder restClientBuilder, EncodingProperties properties,
                          BackofficeProperties backofficeProperties) {
        this.properties = properties;
        this.notificationUrl = backofficeProperties.getApiBaseUrl() + NOTIFICATION_PATH;
        this.restClient = restClientBuilder.baseUrl(properties.getBaseUrl()).build();
    }

    public String authenticate() {
        if (!properties.isConfigured()) {
            throw new IntegrationException("Encoding credentials are not configured");
        }
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("client_id", properties.getClientId());
        form.put("client_secret", properties.getClientSecret());
        form.put("grant_type", "client_credentials");
        try {
            Map<String, Object> token = restClient.post()
                    .uri("/oauth/token")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(form)
                    .retrieve()
                    .body(JSON_OBJECT);
            if (token == null || token.get("access_token") == null) {
                throw new IntegrationException("Encoding token response has no access_token");
            }
            return token.get("access_token").toString();
        } catch (RestClientException e) {
            log.error("Encoding authentication failed | error={}", e.getMessage());
            throw new IntegrationException("Encoding authentication failed: " + e.getMessage(), e);
        }
    }

    /**
     * Submits one job with a single output, {@link EncodingPresets#defaults()} overlaid with {@code preset},
     * and returns the service's answer as is. Completion is reported to this service's webhook.
     */
    public Map<String, Object> createJob(String inputUrl, Map<String, Object> preset) {
        Map<String, Object> job = new LinkedHashMap<>();
        job.put("input", inputUrl);
        job.put("outputs", List.of(EncodingPresets.merge(preset)));
        job.put("notifications", List.of(Map.of("url", notificationUrl, "format", "json")));
        String token = authenticate();
        try {
            Map<String, Object> created = restClient.post()
                    .uri("/jobs")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(job)
                    .retrieve()
                    .body(JSON_OBJECT);
            log.info("Encoding job created | input={} | jobId={}", inputUrl, created == null ? null : created.get("id"));
            return created == null ? Map.of() : created;
        } catch (RestClientException e) {
            log.error("Encoding job creation failed | input={} | error={}", inputUrl, e.getMessage());
            throw new IntegrationException("Encoding job creation failed: " + e.getMessage(), e);
        }
    }

    public Map<String, Object> getJob(String jobId) {
        String token = authenticate();
        try {
            Map<String, Object> job = restClient.get()
                    .uri("/jobs/{id}", jobId)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .retrieve()
                    .body(JSON_OBJECT);
            return job == null ? Map.of() : job;
        } catch (RestClientException e) {
            log.error("Encoding job lookup failed | jobId={} | error={}", jobId, e.getMessage());
            throw new IntegrationException("Encoding job lookup failed: " + e.getMessage(), e);
        }
    }
}
