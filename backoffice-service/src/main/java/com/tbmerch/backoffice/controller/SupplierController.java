package com.tbmerch.backoffice.controller;

import com.tbmerch.backoffice.domain.Supplier;
import com.tbmerch.backoffice.domain.SupplierType;
import com.tbmerch.backoffice.service.SupplierRegistry;
import com.tbmerch.backoffice.service.SupplierRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/suppliers")
@RequiredArgsConstructor
public class SupplierController {

    private final SupplierRegistry supplierRegistry;

    @PostMapping
    public ResponseEntity<SupplierResponse> createSupplier(@Valid @RequestBody SupplierRequest request) {
        Supplier supplier = supplierRegistry.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(SupplierResponse.from(supplier));
    }

    @GetMapping
    public ResponseEntity<List<SupplierResponse>> listSuppliers(
            @RequestParam(name = "active_only", defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(supplierRegistry.list(activeOnly).stream().map(SupplierResponse::from).toList());
    }

    @GetMapping("/{supplierId}")
    public ResponseEntity<SupplierResponse> getSupplier(@PathVariable UUID supplierId) {
        return ResponseEntity.ok(SupplierResponse.from(supplierRegistry.get(supplierId)));
    }

    @PutMapping("/{supplierId}")
    public ResponseEntity<SupplierResponse> updateSupplier(@PathVariable UUID supplierId,
                                                           @Valid @RequestBody SupplierRequest request) {
        return ResponseEntity.ok(SupplierResponse.from(supplierRegistry.update(supplierId, request)));
    }

    @DeleteMapping("/{supplierId}")
    public ResponseEntity<Void> deleteSupplier(@PathVariable UUID supplierId) {
        supplierRegistry.delete(supplierId);
        return ResponseEntity.noContent().build();
    }

    public record SupplierResponse(
            UUID id,
            String name,
            SupplierType type,
            String apiEndpoint,
            String apiKey,
            String webhookUrl,
            Map<String, Object> settings,
            boolean active,
            Instant createdAt,
            Instant updatedAt
    ) {
        public static SupplierResponse from(Supplier supplier) {
            return new SupplierResponse(
                    supplier.getId(),
                    supplier.getName(),
                    supplier.getType(),
                    supplier.getApiEndpoint(),
                    supplier.getApiKey(),
                    supplier.getWebhookUrl(),
                    supplier.getSettings(),
                    supplier.isActive(),
                    supplier.getCreatedAt(),
                    supplier.getUpdatedAt());
        }
    }
}
