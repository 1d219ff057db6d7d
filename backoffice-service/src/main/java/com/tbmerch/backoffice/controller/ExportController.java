package com.tbmerch.backoffice.controller;

import com.tbmerch.backoffice.service.ExportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/export")
@RequiredArgsConstructor
public class ExportController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv");

    private final ExportService exportService;

    @GetMapping("/products")
    public ResponseEntity<String> exportProducts() {
        return csv("products.csv", exportService.exportProducts());
    }

    @GetMapping("/orders")
    public ResponseEntity<String> exportOrders() {
        return csv("orders.csv", exportService.exportOrders());
    }

    @GetMapping("/suppliers")
    public ResponseEntity<String> exportSuppliers() {
        return csv("suppliers.csv", exportService.exportSuppliers());
    }

    private static ResponseEntity<String> csv(String filename, String body) {
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(filename).build().toString())
                .body(body);
    }
}
