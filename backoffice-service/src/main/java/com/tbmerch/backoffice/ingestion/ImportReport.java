package com.tbmerch.backoffice.ingestion;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one import batch. {@code rows} follows the order of the submitted rows.
 */
public record ImportReport(
        String kind,
        UUID supplierId,
        String supplierName,
        int importedCount,
        int failedCount,
        int skippedCount,
        String message,
        List<RowResult> rows
) {

    /**
     * @param row 1-based position in the submitted batch
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RowResult(int row, RowOutcome outcome, UUID id, String reason) {

        static RowResult imported(int row, UUID id) {
            return new RowResult(row, RowOutcome.IMPORTED, id, null);
        }

        static RowResult skipped(int row, String reason) {
            return new RowResult(row, RowOutcome.SKIPPED, null, reason);
        }

        static RowResult failed(int row, String reason) {
            return new RowResult(row, RowOutcome.FAILED, null, reason);
        }
    }

    static ImportReport of(String kind, UUID supplierId, String supplierName, List<RowResult> rows) {
        int imported = count(rows, RowOutcome.IMPORTED);
        int failed = count(rows, RowOutcome.FAILED);
        int skipped = count(rows, RowOutcome.SKIPPED);
        String message = String.format("Imported %d of %d %s (%d failed, %d skipped)",
                imported, rows.size(), kind, failed, skipped);
        return new ImportReport(kind, supplierId, supplierName, imported, failed, skipped, message, List.copyOf(rows));
    }

    private static int count(List<RowResult> rows, RowOutcome outcome) {
        return (int) rows.stream().filter(r -> r.outcome() == outcome).count();
    }
}
