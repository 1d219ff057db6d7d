package com.tbmerch.backoffice.ingestion;

/**
 * A single import row could not be mapped. The row is reported as failed and the batch continues.
 */
public class RowMappingException extends RuntimeException {

    public RowMappingException(String message) {
        super(message);
    }
}
