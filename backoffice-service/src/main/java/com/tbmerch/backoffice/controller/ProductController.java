package com.tbmerch.backoffice.controller;

import com.tbmerch.backoffice.domain.Product;
import com.tbmerch.backoffice.domain.ProductStatus;
import com.tbmerch.backoffice.domain.ProductType;
import com.tbmerch.backoffice.service.ProductRequest;
import com.tbmerch.backoffice.service.ProductService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService productService;

    @PostMapping
    public ResponseEntity<ProductResponse> createProduct(@Valid @RequestBody ProductRequest request) {
        Product product = productService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ProductResponse.from(product));
    }

    @GetMapping
    public ResponseEntity<List<ProductResponse>> listProducts(
            @RequestParam(name = "supplier_id", required = false) UUID supplierId,
            @RequestParam(name = "status", required = false) String status) {
        ProductStatus statusFilter = status == null || status.isBlank() ? null : ProductStatus.fromValue(status);
        return ResponseEntity.ok(productService.list(supplierId, statusFilter).stream()
                .map(ProductResponse::from)
                .toList());
    }

    @GetMapping("/{productId}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable UUID productId) {
        return ResponseEntity.ok(ProductResponse.from(productService.get(productId)));
    }

    @PutMapping("/{productId}")
    public ResponseEntity<ProductResponse> updateProduct(@PathVariable UUID productId,
                                                         @Valid @RequestBody ProductRequest request) {
        return ResponseEntity.ok(ProductResponse.from(productService.update(productId, request)));
    }

    @DeleteMapping("/{productId}")
    public ResponseEntity<Void> deleteProduct(@PathVariable UUID productId) {
        productService.delete(productId);
        return ResponseEntity.noContent().build();
    }

    public record ProductResponse(
            UUID id,
            String name,
            String description,
            BigDecimal price,
            BigDecimal cost,
            String sku,
            UUID supplierId,
            String supplierProductId,
            String supplierVariantId,
            String imageUrl,
            String category,
            List<String> tags,
            ProductType productType,
            ProductStatus status,
            int stockQuantity,
            Double weight,
            Map<String, Object> dimensions,
            String affiliateUrl,
            Double commissionRate,
            Instant createdAt,
            Instant updatedAt
    ) {
        public static ProductResponse from(Product product) {
            return new ProductResponse(
                    product.getId(),
                    product.getName(),
                    product.getDescription(),
                    product.getPrice(),
                    product.getCost(),
                    product.getSku(),
                    product.getSupplierId(),
                    product.getSupplierProductId(),
                    product.getSupplierVariantId(),
                    product.getImageUrl(),
                    product.getCategory(),
                    product.getTags(),
                    product.getProductType(),
                    product.getStatus(),
                    product.getStockQuantity(),
                    product.getWeight(),
                    product.getDimensions(),
                    product.getAffiliateUrl(),
                    product.getCommissionRate(),
                    product.getCreatedAt(),
                    product.getUpdatedAt());
        }
    }
}
