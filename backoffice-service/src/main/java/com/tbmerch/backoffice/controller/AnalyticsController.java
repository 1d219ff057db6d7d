package com.tbmerch.backoffice.controller;

import com.tbmerch.backoffice.service.AnalyticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    @GetMapping("/overview")
    public ResponseEntity<AnalyticsService.Overview> overview() {
        return ResponseEntity.ok(analyticsService.overview());
    }

    @GetMapping("/suppliers")
    public ResponseEntity<List<AnalyticsService.SupplierPerformance>> supplierPerformance() {
        return ResponseEntity.ok(analyticsService.supplierPerformance());
    }
}
