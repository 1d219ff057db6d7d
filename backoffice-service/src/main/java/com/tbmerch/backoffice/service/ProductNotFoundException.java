package com.tbmerch.backoffice.service;

import java.util.UUID;

public class ProductNotFoundException extends ResourceNotFoundException {

    public ProductNotFoundException(UUID id) {
        super("Product not found: " + id);
    }

    @Override
    public String title() {
        return "Product Not Found";
    }
}
