package com.tbmerch.backoffice.ingestion;

/**
 * The import request as a whole is unusable (unknown supplier type, unreadable file). Mapped to 400.
 */
public class ImportValidationException extends RuntimeException {

    public ImportValidationException(String message) {
        super(message);
    }

    public ImportValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
