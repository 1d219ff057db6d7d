package com.tbmerch.backoffice.controller;

import com.tbmerch.backoffice.domain.Supplier;
import com.tbmerch.backoffice.domain.SupplierType;
import com.tbmerch.backoffice.service.SupplierNotFoundException;
import com.tbmerch.backoffice.service.SupplierRegistry;
import com.tbmerch.backoffice.service.SupplierRequest;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SupplierController.class)
class SupplierControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SupplierRegistry supplierRegistry;

    @Test
    void createSupplier_shouldReturn201_withSlugType() throws Exception {
        // Given
        UUID supplierId = UUID.randomUUID();
        when(supplierRegistry.create(any(SupplierRequest.class))).thenReturn(Supplier.builder()
                .id(supplierId).name("CJ").type(SupplierType.CJ_DROPSHIPPING)
                .apiEndpoint("https://cj.example").settings(Map.of()).active(true).build());

        String body = """
                {"name": "CJ", "type": "cj_dropshipping", "api_endpoint": "https://cj.example"}
                """;

        // When / Then
        mockMvc.perform(post("/api/suppliers").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(supplierId.toString()))
                .andExpect(jsonPath("$.type").value("cj_dropshipping"))
                .andExpect(jsonPath("$.api_endpoint").value("https://cj.example"))
                .andExpect(jsonPath("$.active").value(true));

        ArgumentCaptor<SupplierRequest> captor = ArgumentCaptor.forClass(SupplierRequest.class);
        verify(supplierRegistry).create(captor.capture());
        assertEquals(SupplierType.CJ_DROPSHIPPING, captor.getValue().type());
        assertEquals("https://cj.example", captor.getValue().apiEndpoint());
    }

    @Test
    void createSupplier_shouldReturn400_whenTypeUnknown() throws Exception {
        mockMvc.perform(post("/api/suppliers").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"X\", \"type\": \"aliexpress\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Malformed Request"));

        verifyNoInteractions(supplierRegistry);
    }

    @Test
    void createSupplier_shouldReturn400_whenNameBlank() throws Exception {
        mockMvc.perform(post("/api/suppliers").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"\", \"type\": \"direct\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.name").value("name is required"));
    }

    @Test
    void listSuppliers_shouldPassActiveOnly() throws Exception {
        when(supplierRegistry.list(true)).thenReturn(List.of());

        mockMvc.perform(get("/api/suppliers").param("active_only", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        verify(supplierRegistry).list(true);
    }

    @Test
    void deleteSupplier_shouldReturn404_whenMissing() throws Exception {
        UUID supplierId = UUID.randomUUID();
        doThrow(new SupplierNotFoundException(supplierId)).when(supplierRegistry).delete(supplierId);

        mockMvc.perform(delete("/api/suppliers/{supplierId}", supplierId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Supplier Not Found"));
    }
}
