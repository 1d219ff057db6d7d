package com.tbmerch.backoffice.service;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.tbmerch.backoffice.domain.Order;
import com.tbmerch.backoffice.domain.OrderRepository;
import com.tbmerch.backoffice.domain.Product;
import com.tbmerch.backoffice.domain.ProductRepository;
import com.tbmerch.backoffice.domain.Supplier;
import com.tbmerch.backoffice.domain.SupplierRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * CSV exports of the three collections, header row first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExportService {

    private static final CsvMapper CSV = CsvMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .build();

    private final ProductRepository productRepository;
    private final OrderRepository orderRepository;
    private final SupplierRepository supplierRepository;

    @Transactional(readOnly = true)
    public String exportProducts() {
        List<ProductRow> rows = productRepository.findAll().stream()
                .map(p -> new ProductRow(p.getId().toString(), p.getName(), p.getSku(), p.getPrice(), p.getCost(),
                        p.getSupplierId().toString(), p.getCategory(), p.getTags() == null ? "" : String.join(",", p.getTags()),
                        p.getProductType().value(), p.getStatus().value(), p.getStockQuantity(), timestamp(p.getCreatedAt())))
                .toList();
        return write(ProductRow.class, rows, "products");
    }

    @Transactional(readOnly = true)
    public String exportOrders() {
        List<OrderRow> rows = orderRepository.findAll().stream()
                .map(o -> new OrderRow(o.getId().toString(), o.getOrderNumber(), o.getCustomerName(),
                        o.getCustomerEmail(), formatAddress(o.getShippingAddress()),
                        o.getProductId() == null ? null : o.getProductId().toString(),
                        o.getSupplierId() == null ? null : o.getSupplierId().toString(),
                        o.getQuantity(), o.getUnitPrice(), o.getTotalAmount(), o.getStatus().value(),
                        o.getTrackingNumber(), timestamp(o.getCreatedAt())))
                .toList();
        return write(OrderRow.class, rows, "orders");
    }

    @Transactional(readOnly = true)
    public String exportSuppliers() {
        List<SupplierRow> rows = supplierRepository.findAll().stream()
                .map(s -> new SupplierRow(s.getId().toString(), s.getName(), s.getType().slug(),
                        s.getApiEndpoint(), s.isActive(), timestamp(s.getCreatedAt())))
                .toList();
        return write(SupplierRow.class, rows, "suppliers");
    }

    private <T> String write(Class<T> rowType, List<T> rows, String kind) {
        CsvSchema schema = CSV.schemaFor(rowType).withHeader();
        try {
            String csv = CSV.writer(schema).writeValueAsString(rows);
            log.info("Export generated | kind={} | rows={}", kind, rows.size());
            return csv;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not write " + kind + " export", e);
        }
    }

    private static String timestamp(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    static String formatAddress(Map<String, Object> address) {
        if (address == null) {
            return "";
        }
        return Stream.of("address1", "city", "state", "postcode", "country")
                .map(address::get)
                .filter(Objects::nonNull)
                .map(Object::toString)
                .collect(Collectors.joining(", "));
    }

    @JsonPropertyOrder({"id", "name", "sku", "price", "cost", "supplierId", "category", "tags",
            "productType", "status", "stockQuantity", "createdAt"})
    record ProductRow(String id, String name, String sku, BigDecimal price, BigDecimal cost, String supplierId,
                      String category, String tags, String productType, String status, int stockQuantity,
                      String createdAt) {
    }

    @JsonPropertyOrder({"id", "orderNumber", "customerName", "customerEmail", "shippingAddress", "productId",
            "supplierId", "quantity", "unitPrice", "totalAmount", "status", "trackingNumber", "createdAt"})
    record OrderRow(String id, String orderNumber, String customerName, String customerEmail,
                    String shippingAddress, String productId, String supplierId, int quantity,
                    BigDecimal unitPrice, BigDecimal totalAmount, String status, String trackingNumber,
                    String createdAt) {
    }

    @JsonPropertyOrder({"id", "name", "type", "apiEndpoint", "active", "createdAt"})
    record SupplierRow(String id, String name, String type, String apiEndpoint, boolean active, String createdAt) {
    }
}
