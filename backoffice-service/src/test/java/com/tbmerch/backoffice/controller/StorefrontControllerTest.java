package com.tbmerch.backoffice.controller;

import com.tbmerch.backoffice.integration.storefront.StorefrontSyncService;
import com.tbmerch.backoffice.integration.storefront.SyncReport;
import com.tbmerch.backoffice.service.OrderNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(StorefrontController.class)
class StorefrontControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StorefrontSyncService syncService;

    @Test
    void syncProducts_shouldReturnReport_evenWithErrors() throws Exception {
        when(syncService.syncProducts()).thenReturn(new SyncReport(2, 1, 0, List.of("Error syncing Flag: rate limited")));

        mockMvc.perform(post("/api/storefront/sync/products"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(2))
                .andExpect(jsonPath("$.updated").value(1))
                .andExpect(jsonPath("$.errors[0]").value("Error syncing Flag: rate limited"));
    }

    @Test
    void fulfillOrder_shouldReturn400_whenOrderNotFromStorefront() throws Exception {
        UUID orderId = UUID.randomUUID();
        when(syncService.fulfillOrder(orderId))
                .thenThrow(new IllegalArgumentException("Order ORD-1 was not placed through the storefront"));

        mockMvc.perform(post("/api/storefront/orders/{orderId}/fulfill", orderId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Order ORD-1 was not placed through the storefront"));
    }

    @Test
    void pushOrder_shouldReturn404_whenOrderMissing() throws Exception {
        UUID orderId = UUID.randomUUID();
        when(syncService.pushOrder(orderId)).thenThrow(new OrderNotFoundException(orderId));

        mockMvc.perform(post("/api/storefront/orders/{orderId}/push", orderId))
                .andExpect(status().isNotFound());
    }

    @Test
    void pushOrder_shouldReturnStorefrontId() throws Exception {
        UUID orderId = UUID.randomUUID();
        when(syncService.pushOrder(orderId)).thenReturn(Map.of("storefront_order_id", "7777"));

        mockMvc.perform(post("/api/storefront/orders/{orderId}/push", orderId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.storefront_order_id").value("7777"));
    }
}
