package com.tbmerch.backoffice.integration.storefront;

public class WebhookSignatureException extends RuntimeException {

    public WebhookSignatureException(String topic) {
        super("Invalid webhook signature for topic " + topic);
    }
}
