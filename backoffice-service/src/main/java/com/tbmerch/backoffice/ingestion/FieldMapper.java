package com.tbmerch.backoffice.ingestion;

import com.tbmerch.backoffice.domain.Product;
import com.tbmerch.backoffice.domain.ProductStatus;
import com.tbmerch.backoffice.domain.ProductType;
import com.tbmerch.backoffice.domain.SupplierType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Translates rows of supplier exports into canonical products and order drafts.
 * <p>
 * Pure: no lookups and no persistence. The returned product carries no supplier id; the caller attaches it.
 * Supplier types without a mapping yield {@link Optional#empty()}.
 */
@Component
public class FieldMapper {

    static final BigDecimal CJ_COST_RATIO = new BigDecimal("0.50");
    static final BigDecimal DSERS_COST_RATIO = new BigDecimal("0.60");

    public Optional<Product> mapProduct(SupplierType type, RawRow row) {
        return switch (type) {
            case CJ_DROPSHIPPING -> Optional.of(cjProduct(row));
            case DSERS -> Optional.of(dsersProduct(row));
            case IMPACT_AFFILIATE -> Optional.of(affiliateProduct(row));
            case AUTODS, PRINTFUL, PRINTIFY, GELATO, PIETRA, DIRECT -> Optional.empty();
        };
    }

    public Optional<OrderDraft> mapOrder(SupplierType type, RawRow row) {
        return switch (type) {
            case CJ_DROPSHIPPING -> Optional.of(cjOrder(row));
            case DSERS -> Optional.of(dsersOrder(row));
            case IMPACT_AFFILIATE, AUTODS, PRINTFUL, PRINTIFY, GELATO, PIETRA, DIRECT -> Optional.empty();
        };
    }

    // --- CJ Dropshipping: snake_case columns ---

    private Product cjProduct(RawRow row) {
        BigDecimal price = amount(row, "price", BigDecimal.ZERO);
        return physicalProduct(
                row.requiredText("product_name"),
                row.text("description", ""),
                price,
                costOf(price, CJ_COST_RATIO),
                row.requiredText("sku"),
                stock(row, "quantity"),
                row.text("image_url"));
    }

    private OrderDraft cjOrder(RawRow row) {
        Map<String, Object> address = address(
                row.text("address1"), row.text("city"), row.text("state"),
                row.text("country"), row.text("postcode"));
        return new OrderDraft(
                row.text("order_number"),
                customerName(row.text("recipient_first_name"), row.text("recipient_last_name")),
                row.text("email"),
                row.text("phone"),
                address,
                row.text("sku"),
                row.text("product_name"),
                orderQuantity(row, "quantity"),
                amount(row, "price", null),
                null);
    }

    // --- DSERS: PascalCase columns ---

    private Product dsersProduct(RawRow row) {
        BigDecimal price = amount(row, "Price", BigDecimal.ZERO);
        return physicalProduct(
                row.requiredText("ProductName"),
                row.text("Description", ""),
                price,
                costOf(price, DSERS_COST_RATIO),
                row.requiredText("SKU"),
                stock(row, "Quantity"),
                row.text("ImageURL"));
    }

    private OrderDraft dsersOrder(RawRow row) {
        Map<String, Object> address = address(
                row.text("Address1"), row.text("City"), row.text("Province"),
                row.text("Country"), row.text("Zip"));
        String createdAt = row.text("CreatedAt");
        String currency = row.text("Currency");
        return new OrderDraft(
                row.text("OrderID"),
                customerName(row.text("FirstName"), row.text("LastName")),
                row.text("Email"),
                row.text("Phone"),
                address,
                row.text("SKU"),
                row.text("ProductName"),
                orderQuantity(row, "Quantity"),
                amount(row, "Price", null),
                dsersNotes(createdAt, currency));
    }

    // --- Impact affiliate: canonical columns ---

    private Product affiliateProduct(RawRow row) {
        Product product = Product.builder()
                .name(row.requiredText("name"))
                .description(row.text("description", ""))
                .price(amount(row, "price", BigDecimal.ZERO))
                .cost(amount(row, "cost", BigDecimal.ZERO))
                .sku(row.requiredText("sku"))
                .productType(ProductType.AFFILIATE)
                .status(ProductStatus.ACTIVE)
                .stockQuantity(0)
                .affiliateUrl(row.text("affiliate_url"))
                .tags(new ArrayList<>())
                .build();
        BigDecimal commission = row.decimal("commission_rate", null);
        if (commission != null) {
            product.setCommissionRate(commission.doubleValue());
        }
        return product;
    }

    private Product physicalProduct(String name, String description, BigDecimal price, BigDecimal cost,
                                    String sku, int stock, String imageUrl) {
        return Product.builder()
                .name(name)
                .description(description)
                .price(price)
                .cost(cost)
                .sku(sku)
                .stockQuantity(stock)
                .imageUrl(imageUrl)
                .productType(ProductType.PHYSICAL)
                .status(ProductStatus.ACTIVE)
                .tags(new ArrayList<>())
                .build();
    }

    static BigDecimal costOf(BigDecimal price, BigDecimal ratio) {
        return price.multiply(ratio).setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal amount(RawRow row, String key, BigDecimal defaultValue) {
        BigDecimal amount = row.decimal(key, defaultValue);
        if (amount != null && amount.signum() < 0) {
            throw new RowMappingException("Field '" + key + "' must not be negative: " + amount.toPlainString());
        }
        return amount;
    }

    private static int stock(RawRow row, String key) {
        int stock = row.integer(key, 0);
        if (stock < 0) {
            throw new RowMappingException("Field '" + key + "' must not be negative: " + stock);
        }
        return stock;
    }

    private static int orderQuantity(RawRow row, String key) {
        int quantity = row.integer(key, 1);
        if (quantity <= 0) {
            throw new RowMappingException("Field '" + key + "' must be positive: " + quantity);
        }
        return quantity;
    }

    private static String dsersNotes(String createdAt, String currency) {
        if (createdAt == null && currency == null) {
            return null;
        }
        StringBuilder notes = new StringBuilder("DSERS order");
        if (createdAt != null) {
            notes.append(" placed at ").append(createdAt);
        }
        if (currency != null) {
            notes.append(" (").append(currency).append(')');
        }
        return notes.toString();
    }

    private static String customerName(String first, String last) {
        String name = ((first == null ? "" : first) + " " + (last == null ? "" : last)).trim();
        if (name.isEmpty()) {
            throw new RowMappingException("Missing customer name");
        }
        return name;
    }

    private static Map<String, Object> address(String address1, String city, String state,
                                               String country, String postcode) {
        Map<String, Object> address = new LinkedHashMap<>();
        putIfPresent(address, "address1", address1);
        putIfPresent(address, "city", city);
        putIfPresent(address, "state", state);
        putIfPresent(address, "country", country);
        putIfPresent(address, "postcode", postcode);
        return address;
    }

    private static void putIfPresent(Map<String, Object> target, String key, String value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
