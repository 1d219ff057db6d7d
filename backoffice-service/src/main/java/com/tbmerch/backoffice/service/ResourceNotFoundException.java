package com.tbmerch.backoffice.service;

/**
 * Base for lookups by id that found nothing. Mapped to 404.
 */
public abstract class ResourceNotFoundException extends RuntimeException {

    protected ResourceNotFoundException(String message) {
        super(message);
    }

    /** Problem title, e.g. {@code Order Not Found}. */
    public abstract String title();
}
