package com.tbmerch.backoffice.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "products", indexes = @Index(name = "idx_products_supplier_sku", columnList = "supplierId, sku"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(length = 4000)
    private String description;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(precision = 12, scale = 2)
    private BigDecimal cost;

    @Column(nullable = false)
    private String sku;

    /** Plain reference, not a foreign key: products outlive their supplier. */
    @Column(nullable = false)
    private UUID supplierId;

    private String supplierProductId;

    private String supplierVariantId;

    @Column(length = 2000)
    private String imageUrl;

    private String category;

    @Convert(converter = JsonListConverter.class)
    @Column(length = 2000)
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ProductType productType = ProductType.PHYSICAL;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ProductStatus status = ProductStatus.ACTIVE;

    @Column(nullable = false)
    private int stockQuantity;

    private Double weight;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 2000)
    private Map<String, Object> dimensions;

    @Column(length = 2000)
    private String affiliateUrl;

    private Double commissionRate;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
