package com.flagship.impact_ledger.outbox;

import com.flagship.impact_ledger.observability.OutboxMetrics;
import com.flagship.impact_ledger.transaction.event.TransactionCreditedEvent;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publisher loop against a mocked Kafka template. Events are keyed by transaction id.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OutboxPublisherTest {

    private static final String TOPIC = "impact-transactions";
    private static final int MAX_RETRIES = 3;

    @Mock
    private OutboxService outboxService;
    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;
    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "transactionsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", MAX_RETRIES);
    }

    private static OutboxEvent event(UUID transactionId) {
        return OutboxEvent.create("ImpactTransaction", transactionId, TransactionCreditedEvent.EVENT_TYPE,
                "{\"transactionId\":\"" + transactionId + "\"}");
    }

    private static CompletableFuture<SendResult<String, String>> sent(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(TOPIC, event.getAggregateId().toString(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("Published events are keyed by transaction id and marked published in order")
    void testPublish_MarksPublishedInOrder() {
        OutboxEvent first = event(UUID.randomUUID());
        OutboxEvent second = event(UUID.randomUUID());
        when(outboxService.findPublishableEvents(100, MAX_RETRIES)).thenReturn(List.of(first, second));
        when(kafkaTemplate.send(TOPIC, first.getAggregateId().toString(), first.getPayload())).thenReturn(sent(first));
        when(kafkaTemplate.send(TOPIC, second.getAggregateId().toString(), second.getPayload())).thenReturn(sent(second));

        publisher.triggerPublish();

        InOrder order = inOrder(outboxService);
        order.verify(outboxService).markPublished(first.getId());
        order.verify(outboxService).markPublished(second.getId());
        verify(outboxMetrics, never()).recordEventPublishFailed(anyString());
    }

    @Test
    @DisplayName("Failed send records the failure and keeps the event unpublished")
    void testPublish_FailureMarksFailed() {
        OutboxEvent event = event(UUID.randomUUID());
        when(outboxService.findPublishableEvents(100, MAX_RETRIES)).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("broker unavailable")));
        when(outboxService.markFailed(eq(event.getId()), anyString())).thenReturn(1);

        publisher.triggerPublish();

        verify(outboxService, never()).markPublished(any());
        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxMetrics).recordEventPublishFailed(TransactionCreditedEvent.EVENT_TYPE);
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
    }

    @Test
    @DisplayName("Event exhausting its retries is counted as a dead letter")
    void testPublish_DeadLetter() {
        OutboxEvent event = event(UUID.randomUUID());
        when(outboxService.findPublishableEvents(100, MAX_RETRIES)).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("broker unavailable")));
        when(outboxService.markFailed(eq(event.getId()), anyString())).thenReturn(MAX_RETRIES);

        publisher.triggerPublish();

        verify(outboxMetrics).recordEventDeadLettered(TransactionCreditedEvent.EVENT_TYPE);
    }

    @Test
    @DisplayName("Empty outbox sends nothing")
    void testPublish_EmptyOutbox() {
        when(outboxService.findPublishableEvents(100, MAX_RETRIES)).thenReturn(List.of());

        publisher.triggerPublish();

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }
}
