package com.tbmerch.backoffice.service;

import com.tbmerch.backoffice.domain.SupplierType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record SupplierRequest(
        @NotBlank(message = "name is required") String name,
        @NotNull(message = "type is required") SupplierType type,
        String apiEndpoint,
        String apiKey,
        String webhookUrl,
        Map<String, Object> settings,
        Boolean active
) {
}
