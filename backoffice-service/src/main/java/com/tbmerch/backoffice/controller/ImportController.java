package com.tbmerch.backoffice.controller;

import com.tbmerch.backoffice.domain.SupplierType;
import com.tbmerch.backoffice.ingestion.CsvRowReader;
import com.tbmerch.backoffice.ingestion.ImportReport;
import com.tbmerch.backoffice.ingestion.ImportValidationException;
import com.tbmerch.backoffice.ingestion.IngestionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Bulk import of supplier exports, as JSON rows or as a CSV file whose header row names the columns.
 * Row-level problems never fail the request; they are itemised in the returned {@link ImportReport}.
 */
@RestController
@RequestMapping("/api/import")
@RequiredArgsConstructor
public class ImportController {

    private final IngestionService ingestionService;
    private final CsvRowReader csvRowReader;

    @PostMapping("/products")
    public ResponseEntity<ImportReport> importProducts(@Valid @RequestBody ProductImportRequest request) {
        return ResponseEntity.ok(ingestionService.ingestProducts(supplierType(request.supplierType()), request.products()));
    }

    @PostMapping("/orders")
    public ResponseEntity<ImportReport> importOrders(@Valid @RequestBody OrderImportRequest request) {
        return ResponseEntity.ok(ingestionService.ingestOrders(supplierType(request.supplierType()), request.orders()));
    }

    @PostMapping(path = "/products/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportReport> importProductsCsv(@RequestParam("supplier_type") String supplierType,
                                                          @RequestPart("file") MultipartFile file) {
        SupplierType type = supplierType(supplierType);
        return ResponseEntity.ok(ingestionService.ingestProducts(type, readCsv(file)));
    }

    @PostMapping(path = "/orders/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportReport> importOrdersCsv(@RequestParam("supplier_type") String supplierType,
                                                        @RequestPart("file") MultipartFile file) {
        SupplierType type = supplierType(supplierType);
        return ResponseEntity.ok(ingestionService.ingestOrders(type, readCsv(file)));
    }

    private List<Map<String, String>> readCsv(MultipartFile file) {
        if (file.isEmpty()) {
            throw new ImportValidationException("CSV file is empty");
        }
        try (InputStream in = file.getInputStream()) {
            return csvRowReader.read(in);
        } catch (IOException e) {
            throw new ImportValidationException("Could not read uploaded file: " + e.getMessage(), e);
        }
    }

    private static SupplierType supplierType(String value) {
        return SupplierType.fromSlug(value)
                .orElseThrow(() -> new ImportValidationException("Unknown supplier type: " + value));
    }

    public record ProductImportRequest(
            @NotBlank(message = "supplier_type is required") String supplierType,
            @NotNull(message = "products is required") List<Map<String, Object>> products
    ) {}

    public record OrderImportRequest(
            @NotBlank(message = "supplier_type is required") String supplierType,
            @NotNull(message = "orders is required") List<Map<String, Object>> orders
    ) {}
}
