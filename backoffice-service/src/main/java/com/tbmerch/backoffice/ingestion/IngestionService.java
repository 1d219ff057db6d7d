package com.tbmerch.backoffice.ingestion;

import com.tbmerch.backoffice.domain.Order;
import com.tbmerch.backoffice.domain.Product;
import com.tbmerch.backoffice.domain.ProductRepository;
import com.tbmerch.backoffice.domain.Supplier;
import com.tbmerch.backoffice.domain.SupplierType;
import com.tbmerch.backoffice.ingestion.ImportReport.RowResult;
import com.tbmerch.backoffice.service.OrderAttributor;
import com.tbmerch.backoffice.service.OrderService;
import com.tbmerch.backoffice.service.SupplierRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Imports supplier exports row by row.
 * <p>
 * The supplier is resolved once per batch. Each row is mapped and written on its own; a row that fails
 * is recorded in the report and the batch carries on. Rows are not de-duplicated, so importing the
 * same export twice stores everything twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private static final String NO_MAPPING = "No field mapping for supplier type '%s'";

    private final SupplierRegistry supplierRegistry;
    private final FieldMapper fieldMapper;
    private final ProductRepository productRepository;
    private final OrderAttributor orderAttributor;
    private final OrderService orderService;
    private final MeterRegistry meterRegistry;

    private Counter rowsImportedCounter;
    private Counter rowsFailedCounter;
    private Counter rowsSkippedCounter;

    @PostConstruct
    void initMetrics() {
        rowsImportedCounter = Counter.builder("import.rows.imported.total")
                .description("Import rows persisted")
                .register(meterRegistry);
        rowsFailedCounter = Counter.builder("import.rows.failed.total")
                .description("Import rows that could not be mapped or stored")
                .register(meterRegistry);
        rowsSkippedCounter = Counter.builder("import.rows.skipped.total")
                .description("Import rows of supplier types without a mapping")
                .register(meterRegistry);
    }

    public ImportReport ingestProducts(SupplierType type, List<? extends Map<String, ?>> rows) {
        Supplier supplier = supplierRegistry.resolveOrCreate(type);
        log.info("Product import started | supplierId={} | type={} | rows={}", supplier.getId(), type.slug(), rows.size());

        List<RowResult> results = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            int rowNumber = i + 1;
            try {
                Optional<Product> mapped = fieldMapper.mapProduct(type, new RawRow(rows.get(i)));
                if (mapped.isEmpty()) {
                    results.add(skipped(rowNumber, type));
                    continue;
                }
                Product product = mapped.get();
                product.setSupplierId(supplier.getId());
                Product saved = productRepository.save(product);
                rowsImportedCounter.increment();
                results.add(RowResult.imported(rowNumber, saved.getId()));
            } catch (RuntimeException e) {
                results.add(failed(rowNumber, "product", e));
            }
        }
        return finish("products", supplier, results);
    }

    public ImportReport ingestOrders(SupplierType type, List<? extends Map<String, ?>> rows) {
        Supplier supplier = supplierRegistry.resolveOrCreate(type);
        log.info("Order import started | supplierId={} | type={} | rows={}", supplier.getId(), type.slug(), rows.size());

        List<RowResult> results = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            int rowNumber = i + 1;
            try {
                Optional<OrderDraft> mapped = fieldMapper.mapOrder(type, new RawRow(rows.get(i)));
                if (mapped.isEmpty()) {
                    results.add(skipped(rowNumber, type));
                    continue;
                }
                OrderDraft draft = mapped.get();
                Product product = draft.sku() == null ? null
                        : productRepository.findFirstBySupplierIdAndSku(supplier.getId(), draft.sku()).orElse(null);
                Order saved = orderService.recordExternalOrder(
                        orderAttributor.attributeImported(draft, supplier, product));
                rowsImportedCounter.increment();
                results.add(RowResult.imported(rowNumber, saved.getId()));
            } catch (RuntimeException e) {
                results.add(failed(rowNumber, "order", e));
            }
        }
        return finish("orders", supplier, results);
    }

    private RowResult skipped(int rowNumber, SupplierType type) {
        rowsSkippedCounter.increment();
        return RowResult.skipped(rowNumber, String.format(NO_MAPPING, type.slug()));
    }

    private RowResult failed(int rowNumber, String kind, RuntimeException e) {
        rowsFailedCounter.increment();
        log.warn("Import row failed | kind={} | row={} | error={}", kind, rowNumber, e.getMessage());
        return RowResult.failed(rowNumber, e.getMessage());
    }

    private ImportReport finish(String kind, Supplier supplier, List<RowResult> results) {
        ImportReport report = ImportReport.of(kind, supplier.getId(), supplier.getName(), results);
        log.info("Import finished | kind={} | supplierId={} | imported={} | failed={} | skipped={}",
                kind, supplier.getId(), report.importedCount(), report.failedCount(), report.skippedCount());
        return report;
    }
}
