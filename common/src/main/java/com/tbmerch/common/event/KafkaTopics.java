package com.tbmerch.common.event;

/**
 * Topic names shared between the back-office producer and downstream consumers.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String ORDER_CREATED = "order.created";
    public static final String ORDER_STATUS_CHANGED = "order.status-changed";
}
