package com.tbmerch.backoffice.service;

import com.tbmerch.backoffice.domain.Product;
import com.tbmerch.backoffice.domain.ProductRepository;
import com.tbmerch.backoffice.domain.ProductStatus;
import com.tbmerch.backoffice.domain.ProductType;
import com.tbmerch.backoffice.domain.SupplierRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProductServiceTest {

    @Mock
    private ProductRepository productRepository;

    @Mock
    private SupplierRepository supplierRepository;

    @InjectMocks
    private ProductService productService;

    private static ProductRequest request(UUID supplierId) {
        return new ProductRequest("Bay Tee", null, new BigDecimal("20.00"), new BigDecimal("8.00"), "TEE-1",
                supplierId, null, null, null, "Apparel", List.of("tampa", "tee"), null, null, null,
                null, null, null, null);
    }

    @Test
    void create_shouldApplyDefaultsAndSave() {
        // Given
        UUID supplierId = UUID.randomUUID();
        when(supplierRepository.existsById(supplierId)).thenReturn(true);
        when(productRepository.save(any(Product.class))).thenAnswer(invocation -> {
            Product product = invocation.getArgument(0);
            product.setId(UUID.randomUUID());
            return product;
        });

        // When
        Product result = productService.create(request(supplierId));

        // Then
        assertNotNull(result.getId());
        assertEquals(supplierId, result.getSupplierId());
        assertEquals(ProductType.PHYSICAL, result.getProductType());
        assertEquals(ProductStatus.ACTIVE, result.getStatus());
        assertEquals(0, result.getStockQuantity());
        assertEquals("", result.getDescription());
        assertEquals(List.of("tampa", "tee"), result.getTags());
    }

    @Test
    void create_shouldThrowSupplierNotFound_andSaveNothing() {
        // Given
        UUID supplierId = UUID.randomUUID();
        when(supplierRepository.existsById(supplierId)).thenReturn(false);

        // When / Then
        SupplierNotFoundException ex = assertThrows(SupplierNotFoundException.class,
                () -> productService.create(request(supplierId)));
        assertTrue(ex.getMessage().contains(supplierId.toString()));
        verify(productRepository, never()).save(any());
    }

    @Test
    void update_shouldOverwriteFields() {
        // Given
        UUID productId = UUID.randomUUID();
        UUID supplierId = UUID.randomUUID();
        Product existing = Product.builder().id(productId).name("Old").sku("OLD").price(BigDecimal.ONE)
                .supplierId(UUID.randomUUID()).stockQuantity(9).build();
        when(productRepository.findById(productId)).thenReturn(Optional.of(existing));
        when(supplierRepository.existsById(supplierId)).thenReturn(true);
        when(productRepository.save(any(Product.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        Product result = productService.update(productId, request(supplierId));

        // Then
        assertEquals("Bay Tee", result.getName());
        assertEquals("TEE-1", result.getSku());
        assertEquals(supplierId, result.getSupplierId());
        assertEquals(0, result.getStockQuantity());
    }

    @Test
    void get_shouldThrowProductNotFound_whenMissing() {
        UUID productId = UUID.randomUUID();
        when(productRepository.findById(productId)).thenReturn(Optional.empty());

        ProductNotFoundException ex = assertThrows(ProductNotFoundException.class, () -> productService.get(productId));
        assertEquals("Product Not Found", ex.title());
    }

    @Test
    void list_shouldCombineFilters() {
        UUID supplierId = UUID.randomUUID();
        when(productRepository.findBySupplierIdAndStatus(supplierId, ProductStatus.ACTIVE)).thenReturn(List.of());

        productService.list(supplierId, ProductStatus.ACTIVE);

        verify(productRepository).findBySupplierIdAndStatus(supplierId, ProductStatus.ACTIVE);
        verify(productRepository, never()).findAll();
    }
}
