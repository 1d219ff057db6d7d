package com.tbmerch.backoffice.integration.storefront;

import com.tbmerch.backoffice.config.StorefrontProperties;
import com.tbmerch.backoffice.domain.Product;
import com.tbmerch.backoffice.integration.IntegrationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class StorefrontClientTest {

    private static final String BASE = "https://tbmerch.myshopify.com/admin/api/2024-01";

    private MockRestServiceServer server;
    private StorefrontClient client;

    @BeforeEach
    void setUp() {
        StorefrontProperties properties = new StorefrontProperties();
        properties.setStore("tbmerch.myshopify.com");
        properties.setAccessToken("shpat_test");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new StorefrontClient(builder, properties);
    }

    @Test
    void listProducts_shouldSendAccessToken_andReadFirstPage() {
        // Given
        server.expect(requestTo(BASE + "/products.json?limit=250"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(StorefrontClient.ACCESS_TOKEN_HEADER, "shpat_test"))
                .andRespond(withSuccess("""
                        {"products": [{"id": 11, "title": "Cap", "variants": [{"id": 501, "sku": "CAP-1", "price": "19.99"}]}]}
                        """, MediaType.APPLICATION_JSON));

        // When
        List<StorefrontProduct> products = client.listProducts();

        // Then
        server.verify();
        assertEquals(1, products.size());
        assertEquals(11L, products.get(0).id());
        assertEquals("CAP-1", products.get(0).firstSku());
    }

    @Test
    void listProducts_shouldReturnEmpty_whenKeyMissing() {
        server.expect(requestTo(BASE + "/products.json?limit=250"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertTrue(client.listProducts().isEmpty());
    }

    @Test
    void createProduct_shouldSendVariantAndMetafields() {
        // Given
        UUID supplierId = UUID.randomUUID();
        Product product = Product.builder()
                .name("Bolts Cap").description("Fitted").price(new BigDecimal("24.50")).sku("CAP-1")
                .supplierId(supplierId).stockQuantity(7).tags(List.of("hockey", "cap")).build();

        server.expect(requestTo(BASE + "/products.json"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.product.title").value("Bolts Cap"))
                .andExpect(jsonPath("$.product.vendor").value("TampaBay Merch"))
                .andExpect(jsonPath("$.product.product_type").value("Sports Merchandise"))
                .andExpect(jsonPath("$.product.status").value("active"))
                .andExpect(jsonPath("$.product.tags").value("hockey, cap"))
                .andExpect(jsonPath("$.product.variants[0].price").value("24.50"))
                .andExpect(jsonPath("$.product.variants[0].sku").value("CAP-1"))
                .andExpect(jsonPath("$.product.variants[0].inventory_quantity").value(7))
                .andExpect(jsonPath("$.product.metafields[0].value").value(supplierId.toString()))
                .andExpect(jsonPath("$.product.id").doesNotExist())
                .andRespond(withSuccess("{\"product\": {\"id\": 12, \"title\": \"Bolts Cap\"}}", MediaType.APPLICATION_JSON));

        // When
        StorefrontProduct created = client.createProduct(product);

        // Then
        server.verify();
        assertEquals(12L, created.id());
    }

    @Test
    void fulfillOrder_shouldUseFirstLocation() {
        server.expect(requestTo(BASE + "/locations.json"))
                .andRespond(withSuccess("{\"locations\": [{\"id\": 77}, {\"id\": 78}]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/orders/900/fulfillments.json"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.fulfillment.location_id").value(77))
                .andExpect(jsonPath("$.fulfillment.tracking_number").value("1Z999"))
                .andExpect(jsonPath("$.fulfillment.notify_customer").value(true))
                .andRespond(withSuccess("{\"fulfillment\": {\"id\": 5, \"status\": \"success\"}}", MediaType.APPLICATION_JSON));

        Map<String, Object> fulfillment = client.fulfillOrder("900", "1Z999");

        server.verify();
        assertEquals("success", fulfillment.get("status"));
    }

    @Test
    void call_shouldWrapHttpFailures() {
        server.expect(requestTo(BASE + "/shop.json")).andRespond(withServerError());

        IntegrationException ex = assertThrows(IntegrationException.class, () -> client.shop());

        assertTrue(ex.getMessage().startsWith("Storefront get shop failed"));
    }

    @Test
    void call_shouldFail_whenNotConfigured() {
        StorefrontClient unconfigured = new StorefrontClient(RestClient.builder(), new StorefrontProperties());

        assertFalse(unconfigured.isConfigured());
        IntegrationException ex = assertThrows(IntegrationException.class, unconfigured::listProducts);
        assertEquals("Storefront credentials are not configured", ex.getMessage());
    }
}
