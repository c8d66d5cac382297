package com.flagship.retail_ledger.outbox;

import com.flagship.retail_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publisher behaviour against a mocked broker: acknowledgement, failure bookkeeping and
 * the last-retry dead-letter count.
 */
class OutboxPublisherTest {

    private static final String TOPIC = "ledger-events";

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private OutboxMetrics outboxMetrics;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        outboxMetrics = mock(OutboxMetrics.class);
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "ledgerTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 10);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
    }

    private OutboxEvent pending(int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "Sale", UUID.randomUUID(), "SaleCreated",
            "{\"saleId\":\"x\"}", Instant.now(), null, retryCount, null, 1L);
    }

    private CompletableFuture<SendResult<String, String>> acknowledged(OutboxEvent event) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(TOPIC, event.getAggregateId().toString(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("An acknowledged send is keyed by aggregate id and marked published")
    void testPublishesKeyedByAggregate() {
        OutboxEvent event = pending(0);
        when(outboxService.findUnpublishedEvents(10, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, event.getAggregateId().toString(), event.getPayload()))
            .thenReturn(acknowledged(event));

        publisher.triggerPublish();

        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("SaleCreated");
        verify(outboxService, never()).markFailed(eq(event.getId()), anyString());
    }

    @Test
    @DisplayName("A failed send is recorded without dead-lettering while retries remain")
    void testFailedSendIsRecorded() {
        OutboxEvent event = pending(0);
        when(outboxService.findUnpublishedEvents(10, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, event.getAggregateId().toString(), event.getPayload()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.triggerPublish();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxMetrics).recordEventPublishFailed("SaleCreated");
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
        verify(outboxService, never()).markPublished(event.getId());
    }

    @Test
    @DisplayName("The send that uses up the last retry counts the event as dead-lettered")
    void testLastRetryDeadLetters() {
        OutboxEvent event = pending(2);
        when(outboxService.findUnpublishedEvents(10, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, event.getAggregateId().toString(), event.getPayload()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.triggerPublish();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxMetrics).recordEventDeadLettered("SaleCreated");
    }

    @Test
    @DisplayName("A failing poll is contained and nothing is sent")
    void testPollFailureIsContained() {
        when(outboxService.findUnpublishedEvents(10, 3)).thenThrow(new IllegalStateException("db down"));

        publisher.triggerPublish();

        verify(outboxService, never()).markPublished(any());
    }
}
