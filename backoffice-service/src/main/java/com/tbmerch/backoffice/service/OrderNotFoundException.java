package com.tbmerch.backoffice.service;

import java.util.UUID;

public class OrderNotFoundException extends ResourceNotFoundException {

    public OrderNotFoundException(UUID id) {
        super("Order not found: " + id);
    }

    @Override
    public String title() {
        return "Order Not Found";
    }
}
