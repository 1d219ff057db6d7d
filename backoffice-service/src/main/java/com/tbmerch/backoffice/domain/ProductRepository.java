package com.tbmerch.backoffice.domain;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProductRepository extends JpaRepository<Product, UUID> {

    List<Product> findBySupplierId(UUID supplierId);

    List<Product> findByStatus(ProductStatus status);

    List<Product> findBySupplierIdAndStatus(UUID supplierId, ProductStatus status);

    Optional<Product> findFirstBySupplierIdAndSku(UUID supplierId, String sku);

    Optional<Product> findFirstBySku(String sku);
}
