package com.tbmerch.backoffice.service;

import java.util.UUID;

public class SupplierNotFoundException extends ResourceNotFoundException {

    public SupplierNotFoundException(UUID id) {
        super("Supplier not found: " + id);
    }

    @Override
    public String title() {
        return "Supplier Not Found";
    }
}
