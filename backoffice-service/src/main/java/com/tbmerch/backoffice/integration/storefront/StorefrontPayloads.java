package com.tbmerch.backoffice.integration.storefront;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tbmerch.backoffice.config.StorefrontProperties;
import com.tbmerch.backoffice.domain.Order;
import com.tbmerch.backoffice.domain.Product;
import com.tbmerch.backoffice.domain.ProductStatus;

import java.util.List;
import java.util.Map;

/**
 * Request bodies sent to the Admin API.
 */
public final class StorefrontPayloads {

    private StorefrontPayloads() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ProductWrite(
            @JsonProperty("id") Long id,
            @JsonProperty("title") String title,
            @JsonProperty("body_html") String bodyHtml,
            @JsonProperty("vendor") String vendor,
            @JsonProperty("product_type") String productType,
            @JsonProperty("status") String status,
            @JsonProperty("tags") String tags,
            @JsonProperty("variants") List<VariantWrite> variants,
            @JsonProperty("metafields") List<Metafield> metafields,
            @JsonProperty("images") List<Image> images
    ) {
    }

    public record VariantWrite(
            @JsonProperty("price") String price,
            @JsonProperty("inventory_quantity") int inventoryQuantity,
            @JsonProperty("sku") String sku,
            @JsonProperty("inventory_management") String inventoryManagement,
            @JsonProperty("inventory_policy") String inventoryPolicy
    ) {
    }

    public record Metafield(
            @JsonProperty("namespace") String namespace,
            @JsonProperty("key") String key,
            @JsonProperty("value") String value,
            @JsonProperty("type") String type
    ) {
    }

    public record Image(@JsonProperty("src") String src, @JsonProperty("alt") String alt) {
    }

    public record FulfillmentWrite(
            @JsonProperty("location_id") Long locationId,
            @JsonProperty("tracking_number") String trackingNumber,
            @JsonProperty("notify_customer") boolean notifyCustomer
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OrderWrite(
            @JsonProperty("email") String email,
            @JsonProperty("line_items") List<LineItemWrite> lineItems,
            @JsonProperty("billing_address") Map<String, Object> billingAddress,
            @JsonProperty("shipping_address") Map<String, Object> shippingAddress,
            @JsonProperty("financial_status") String financialStatus,
            @JsonProperty("note") String note
    ) {
    }

    public record LineItemWrite(
            @JsonProperty("variant_id") Long variantId,
            @JsonProperty("quantity") int quantity,
            @JsonProperty("price") String price
    ) {
    }

    /** A paid order for a single variant, billed and shipped to the same address. */
    public static OrderWrite order(Order order, long variantId) {
        return new OrderWrite(
                order.getCustomerEmail(),
                List.of(new LineItemWrite(variantId, order.getQuantity(), order.getUnitPrice().toPlainString())),
                order.getShippingAddress(),
                order.getShippingAddress(),
                "paid",
                order.getOrderNumber());
    }

    /**
     * One variant carrying price, stock and SKU; inactive products are pushed as drafts.
     * {@code remoteId} is {@code null} for a create.
     */
    public static ProductWrite product(Product product, Long remoteId, StorefrontProperties.Catalog catalog) {
        String namespace = catalog.getMetafieldNamespace();
        List<Metafield> metafields = List.of(
                new Metafield(namespace, "supplier_id", String.valueOf(product.getSupplierId()), "single_line_text_field"),
                new Metafield(namespace, "product_type", product.getProductType().value(), "single_line_text_field"));
        List<Image> images = product.getImageUrl() == null ? null
                : List.of(new Image(product.getImageUrl(), product.getName()));
        return new ProductWrite(
                remoteId,
                product.getName(),
                product.getDescription(),
                catalog.getVendor(),
                product.getCategory() == null ? catalog.getDefaultProductType() : product.getCategory(),
                product.getStatus() == ProductStatus.ACTIVE ? "active" : "draft",
                product.getTags() == null ? "" : String.join(", ", product.getTags()),
                List.of(new VariantWrite(product.getPrice().toPlainString(), product.getStockQuantity(),
                        product.getSku(), "shopify", "deny")),
                metafields,
                images);
    }
}
