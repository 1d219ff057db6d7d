package com.tbmerch.backoffice.integration.storefront;

import java.util.List;

/**
 * Result of a best-effort synchronisation: what went through and one message per failure.
 */
public record SyncReport(int created, int updated, int skipped, List<String> errors) {
}
