package com.tbmerch.backoffice.service;

import com.tbmerch.backoffice.domain.Product;
import com.tbmerch.backoffice.domain.ProductRepository;
import com.tbmerch.backoffice.domain.ProductStatus;
import com.tbmerch.backoffice.domain.ProductType;
import com.tbmerch.backoffice.domain.SupplierRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProductService {

    private final ProductRepository productRepository;
    private final SupplierRepository supplierRepository;

    /**
     * Creates a product for an existing supplier. Fails with {@link SupplierNotFoundException}
     * and persists nothing when the supplier does not exist.
     */
    @Transactional
    public Product create(ProductRequest request) {
        requireSupplier(request.supplierId());

        Product product = new Product();
        apply(product, request);
        Product saved = productRepository.save(product);
        log.info("Product created | productId={} | sku={} | supplierId={} | price={}",
                saved.getId(), saved.getSku(), saved.getSupplierId(), saved.getPrice());
        return saved;
    }

    @Transactional(readOnly = true)
    public Product get(UUID productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    @Transactional(readOnly = true)
    public List<Product> list(UUID supplierId, ProductStatus status) {
        if (supplierId != null && status != null) {
            return productRepository.findBySupplierIdAndStatus(supplierId, status);
        }
        if (supplierId != null) {
            return productRepository.findBySupplierId(supplierId);
        }
        if (status != null) {
            return productRepository.findByStatus(status);
        }
        return productRepository.findAll();
    }

    /** Overwrites every field with the request. The supplier must still exist. */
    @Transactional
    public Product update(UUID productId, ProductRequest request) {
        Product product = get(productId);
        requireSupplier(request.supplierId());
        apply(product, request);
        log.info("Product updated | productId={} | sku={} | status={}",
                productId, product.getSku(), product.getStatus());
        return productRepository.save(product);
    }

    @Transactional
    public void delete(UUID productId) {
        if (!productRepository.existsById(productId)) {
            throw new ProductNotFoundException(productId);
        }
        productRepository.deleteById(productId);
        log.info("Product deleted | productId={}", productId);
    }

    private void requireSupplier(UUID supplierId) {
        if (!supplierRepository.existsById(supplierId)) {
            throw new SupplierNotFoundException(supplierId);
        }
    }

    private void apply(Product product, ProductRequest request) {
        product.setName(request.name());
        product.setDescription(request.description() == null ? "" : request.description());
        product.setPrice(request.price());
        product.setCost(request.cost());
        product.setSku(request.sku());
        product.setSupplierId(request.supplierId());
        product.setSupplierProductId(request.supplierProductId());
        product.setSupplierVariantId(request.supplierVariantId());
        product.setImageUrl(request.imageUrl());
        product.setCategory(request.category());
        product.setTags(request.tags() == null ? new ArrayList<>() : new ArrayList<>(request.tags()));
        product.setProductType(request.productType() == null ? ProductType.PHYSICAL : request.productType());
        product.setStatus(request.status() == null ? ProductStatus.ACTIVE : request.status());
        product.setStockQuantity(request.stockQuantity() == null ? 0 : request.stockQuantity());
        product.setWeight(request.weight());
        product.setDimensions(request.dimensions() == null ? null : new HashMap<>(request.dimensions()));
        product.setAffiliateUrl(request.affiliateUrl());
        product.setCommissionRate(request.commissionRate());
    }
}
