package com.flagship.bank_transfer.outbox;

import com.flagship.bank_transfer.observability.OutboxMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Publisher behavior against a mocked broker: keyed sends with event headers,
 * retry bookkeeping and dead letters.
 */
class OutboxPublisherTest {

    private static final String TOPIC = "bank.transfers";

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private SimpleMeterRegistry registry;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        registry = new SimpleMeterRegistry();

        publisher = new OutboxPublisher(outboxService, kafkaTemplate, new OutboxMetrics(outboxService, registry, 3));
        ReflectionTestUtils.setField(publisher, "transfersTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
    }

    @Test
    @DisplayName("Events are sent keyed by transfer id with event headers and marked published")
    @SuppressWarnings("unchecked")
    void testPublishesKeyedByTransferId() {
        OutboxEvent event = event("tr_1", 0);
        when(outboxService.claimBatch(100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenAnswer(invocation -> acked(invocation.getArgument(0)));

        assertEquals(1, publisher.triggerPublish());

        ArgumentCaptor<ProducerRecord<String, String>> sent = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(sent.capture());
        ProducerRecord<String, String> record = sent.getValue();
        assertEquals(TOPIC, record.topic());
        assertEquals("tr_1", record.key());
        assertEquals(event.getPayload(), record.value());
        assertEquals(event.getId().toString(), header(record, OutboxPublisher.HEADER_EVENT_ID));
        assertEquals("TransferCompleted", header(record, OutboxPublisher.HEADER_EVENT_TYPE));

        verify(outboxService).markPublished(event.getId());
        verify(outboxService, never()).markFailed(any(), anyString());
        assertEquals(1.0, sends("published"));
    }

    @Test
    @DisplayName("A failed send records the error and leaves the event for the next poll")
    @SuppressWarnings("unchecked")
    void testFailedSendMarksFailed() {
        OutboxEvent event = event("tr_2", 1);
        when(outboxService.claimBatch(100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        assertEquals(0, publisher.triggerPublish());

        verify(outboxService).markFailed(eq(event.getId()), contains("broker unavailable"));
        verify(outboxService, never()).markPublished(any());
        assertEquals(1.0, sends("failed"));
    }

    @Test
    @DisplayName("One failing event does not stop the rest of the batch")
    @SuppressWarnings("unchecked")
    void testBatchContinuesAfterFailure() {
        OutboxEvent bad = event("tr_bad", 0);
        OutboxEvent good = event("tr_good", 0);
        when(outboxService.claimBatch(100)).thenReturn(List.of(bad, good));
        when(kafkaTemplate.send(argThat((ProducerRecord<String, String> r) -> r != null && "tr_bad".equals(r.key()))))
                .thenThrow(new IllegalStateException("serializer"));
        when(kafkaTemplate.send(argThat((ProducerRecord<String, String> r) -> r != null && "tr_good".equals(r.key()))))
                .thenAnswer(invocation -> acked(invocation.getArgument(0)));

        assertEquals(1, publisher.triggerPublish());

        verify(outboxService).markFailed(eq(bad.getId()), anyString());
        verify(outboxService).markPublished(good.getId());
    }

    @Test
    @DisplayName("Events at the retry limit are not sent again")
    void testDeadLetterSkipped() {
        OutboxEvent exhausted = event("tr_3", 3);
        when(outboxService.claimBatch(100)).thenReturn(List.of(exhausted));

        assertEquals(0, publisher.triggerPublish());

        verifyNoInteractions(kafkaTemplate);
        verify(outboxService, never()).markFailed(any(), anyString());
        assertEquals(1.0, sends("dead_lettered"));
    }

    @Test
    @DisplayName("A failed poll is logged and the scheduler keeps running")
    void testPollFailureSwallowed() {
        when(outboxService.claimBatch(anyInt())).thenThrow(new DataAccessResourceFailureException("db down"));

        int published = publisher.publishPendingEvents();

        assertEquals(0, published);
        verifyNoInteractions(kafkaTemplate);
    }

    private double sends(String outcome) {
        return registry.counter("transfers.outbox.sends", "event_type", "TransferCompleted", "outcome", outcome)
                .count();
    }

    private static String header(ProducerRecord<String, String> record, String name) {
        return new String(record.headers().lastHeader(name).value(), StandardCharsets.UTF_8);
    }

    private static OutboxEvent event(String transferId, int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), OutboxService.AGGREGATE_TRANSFER, transferId,
                "TransferCompleted", "{\"transferId\":\"" + transferId + "\"}",
                Instant.parse("2024-05-01T10:00:00Z"), null, retryCount, null, null);
    }

    private static CompletableFuture<SendResult<String, String>> acked(ProducerRecord<String, String> record) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(record.topic(), 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }
}
