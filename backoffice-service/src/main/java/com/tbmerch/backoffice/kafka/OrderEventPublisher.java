package com.tbmerch.backoffice.kafka;

import com.tbmerch.common.event.KafkaTopics;
import com.tbmerch.common.event.OrderEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes order lifecycle events. Keyed by order id so all events of one order land on the same partition.
 * <p>
 * Delivery is asynchronous; a failed send is logged and never fails the request that triggered it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderEventPublisher {

    private final KafkaTemplate<String, OrderEvent> kafkaTemplate;

    public CompletableFuture<SendResult<String, OrderEvent>> publishCreated(OrderEvent event) {
        return publish(KafkaTopics.ORDER_CREATED, event);
    }

    public CompletableFuture<SendResult<String, OrderEvent>> publishStatusChanged(OrderEvent event) {
        return publish(KafkaTopics.ORDER_STATUS_CHANGED, event);
    }

    private CompletableFuture<SendResult<String, OrderEvent>> publish(String topic, OrderEvent event) {
        String key = event.orderId().toString();
        log.info("Publishing event to [{}] | key={} | eventId={} | status={}",
                topic, key, event.eventId(), event.status());

        CompletableFuture<SendResult<String, OrderEvent>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException ex) {
            log.error("FAILED to publish event to [{}] | key={} | eventId={} | error={}",
                    topic, key, event.eventId(), ex.getMessage(), ex);
            return CompletableFuture.failedFuture(ex);
        }

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("FAILED to publish event to [{}] | key={} | eventId={} | error={}",
                        topic, key, event.eventId(), ex.getMessage(), ex);
            } else {
                var metadata = result.getRecordMetadata();
                log.info("SUCCESS published to [{}] | partition={} | offset={} | key={} | eventId={}",
                        metadata.topic(), metadata.partition(), metadata.offset(), key, event.eventId());
            }
        });
        return future;
    }
}
