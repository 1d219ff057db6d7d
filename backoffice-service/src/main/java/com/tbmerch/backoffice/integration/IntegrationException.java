package com.tbmerch.backoffice.integration;

/**
 * A call to an external service failed (transport error, non-2xx answer, missing credentials).
 */
public class IntegrationException extends RuntimeException {

    public IntegrationException(String message) {
        super(message);
    }

    public IntegrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
