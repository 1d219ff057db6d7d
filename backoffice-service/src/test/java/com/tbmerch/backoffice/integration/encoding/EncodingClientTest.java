package com.tbmerch.backoffice.integration.encoding;

import com.tbmerch.backoffice.config.BackofficeProperties;
import com.tbmerch.backoffice.config.EncodingProperties;
import com.tbmerch.backoffice.integration.IntegrationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class EncodingClientTest {

    private static final String BASE = "https://encoder.example/v2";
    private static final String TOKEN = "{\"access_token\": \"tok-1\", \"token_type\": \"bearer\"}";

    private MockRestServiceServer server;
    private EncodingClient client;

    @BeforeEach
    void setUp() {
        EncodingProperties properties = new EncodingProperties();
        properties.setBaseUrl(BASE);
        properties.setClientId("client");
        properties.setClientSecret("secret");
        BackofficeProperties backofficeProperties = new BackofficeProperties();
        backofficeProperties.setApiBaseUrl("https://backoffice.example");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new EncodingClient(builder, properties, backofficeProperties);
    }

    @Test
    void createJob_shouldAuthenticate_thenPostMergedOutputAndNotification() {
        // Given
        server.expect(requestTo(BASE + "/oauth/token"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.client_id").value("client"))
                .andExpect(jsonPath("$.client_secret").value("secret"))
                .andExpect(jsonPath("$.grant_type").value("client_credentials"))
                .andRespond(withSuccess(TOKEN, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/jobs"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer tok-1"))
                .andExpect(jsonPath("$.input").value("https://cdn.example/cap.jpg"))
                .andExpect(jsonPath("$.outputs[0].label").value("product_image_optimized"))
                .andExpect(jsonPath("$.outputs[0].format").value("jpg"))
                .andExpect(jsonPath("$.outputs[0].video_codec").value("h264"))
                .andExpect(jsonPath("$.outputs[0].width").value(800))
                .andExpect(jsonPath("$.notifications[0].url")
                        .value("https://backoffice.example/api/webhooks/zencoder/job_complete"))
                .andExpect(jsonPath("$.notifications[0].format").value("json"))
                .andRespond(withSuccess("{\"id\": 3141, \"outputs\": [{\"id\": 1}]}", MediaType.APPLICATION_JSON));

        // When
        Map<String, Object> job = client.createJob("https://cdn.example/cap.jpg", EncodingPresets.productImage());

        // Then
        server.verify();
        assertEquals(3141, job.get("id"));
    }

    @Test
    void authenticate_shouldFail_whenTokenMissing() {
        server.expect(requestTo(BASE + "/oauth/token"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        IntegrationException ex = assertThrows(IntegrationException.class, () -> client.authenticate());

        assertEquals("Encoding token response has no access_token", ex.getMessage());
    }

    @Test
    void authenticate_shouldFail_withoutCredentials() {
        EncodingClient unconfigured = new EncodingClient(RestClient.builder(), new EncodingProperties(),
                new BackofficeProperties());

        assertThrows(IntegrationException.class, unconfigured::authenticate);
    }

    @Test
    void authenticate_shouldFail_withoutCallingApi_whenCredentialsAreBlank() {
        // Given
        EncodingProperties properties = new EncodingProperties();
        properties.setBaseUrl(BASE);
        properties.setClientId("");
        properties.setClientSecret(" ");
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer blankServer = MockRestServiceServer.bindTo(builder).build();
        EncodingClient blank = new EncodingClient(builder, properties, new BackofficeProperties());

        // When
        IntegrationException ex = assertThrows(IntegrationException.class, blank::authenticate);

        // Then
        assertEquals("Encoding credentials are not configured", ex.getMessage());
        blankServer.verify();
    }

    @Test
    void getJob_shouldWrapHttpErrors() {
        server.expect(requestTo(BASE + "/oauth/token"))
                .andRespond(withSuccess(TOKEN, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/jobs/42"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withBadRequest());

        IntegrationException ex = assertThrows(IntegrationException.class, () -> client.getJob("42"));

        assertTrue(ex.getMessage().startsWith("Encoding job lookup failed"));
    }
}
