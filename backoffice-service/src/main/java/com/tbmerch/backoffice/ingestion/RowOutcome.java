package com.tbmerch.backoffice.ingestion;

public enum RowOutcome {
    IMPORTED,
    SKIPPED,
    FAILED
}
