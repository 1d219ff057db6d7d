package com.tbmerch.backoffice.kafka;

import com.tbmerch.common.event.KafkaTopics;
import com.tbmerch.common.event.OrderEvent;
import com.tbmerch.common.event.OrderStatus;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderEventPublisherTest {

    @Mock
    private KafkaTemplate<String, OrderEvent> kafkaTemplate;

    @InjectMocks
    private OrderEventPublisher publisher;

    @Test
    void publishCreated_shouldSendToCreatedTopic_keyedByOrderId() {
        // Given
        OrderEvent event = event();
        String key = event.orderId().toString();
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(KafkaTopics.ORDER_CREATED, 0), 5L, 0, 0L, 36, 200);
        SendResult<String, OrderEvent> sendResult =
                new SendResult<>(new ProducerRecord<>(KafkaTopics.ORDER_CREATED, key, event), metadata);
        when(kafkaTemplate.send(KafkaTopics.ORDER_CREATED, key, event))
                .thenReturn(CompletableFuture.completedFuture(sendResult));

        // When
        CompletableFuture<SendResult<String, OrderEvent>> future = publisher.publishCreated(event);

        // Then
        assertSame(sendResult, future.join());
        verify(kafkaTemplate).send(KafkaTopics.ORDER_CREATED, key, event);
    }

    @Test
    void publishStatusChanged_shouldReturnFailedFuture_whenSendThrows() {
        // Given
        OrderEvent event = event();
        when(kafkaTemplate.send(anyString(), anyString(), any(OrderEvent.class)))
                .thenThrow(new IllegalStateException("producer closed"));

        // When
        CompletableFuture<SendResult<String, OrderEvent>> future = publisher.publishStatusChanged(event);

        // Then
        assertTrue(future.isCompletedExceptionally());
        verify(kafkaTemplate).send(KafkaTopics.ORDER_STATUS_CHANGED, event.orderId().toString(), event);
    }

    @Test
    void publishCreated_shouldNotThrow_whenBrokerRejectsAsynchronously() {
        OrderEvent event = event();
        when(kafkaTemplate.send(anyString(), anyString(), any(OrderEvent.class)))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("timeout")));

        CompletableFuture<SendResult<String, OrderEvent>> future = publisher.publishCreated(event);

        assertTrue(future.isCompletedExceptionally());
    }

    private static OrderEvent event() {
        return OrderEvent.created(UUID.randomUUID(), "ORD-1A2B3C4D", UUID.randomUUID(), UUID.randomUUID(),
                3, new BigDecimal("60.00"), OrderStatus.PENDING);
    }
}
