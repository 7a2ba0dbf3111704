package com.flagship.bank_transfer.outbox;

import com.flagship.bank_transfer.observability.OutboxMetrics;
import com.flagship.bank_transfer.observability.OutboxMetrics.Outcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drains queued transfer events to Kafka.
 *
 * Records are keyed by transfer id so all events of one transfer land on the
 * same partition, and carry {@code event_id} and {@code event_type} headers.
 * Sends are synchronous; an event is marked published only once the broker
 * acknowledged it. Delivery is therefore at-least-once.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String HEADER_EVENT_ID = "event_id";
    static final String HEADER_EVENT_TYPE = "event_type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.transfers:bank.transfers}")
    private String transfersTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs = 10000;

    /**
     * Publishes one batch.
     *
     * @return number of events acknowledged by the broker
     */
    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public int publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.claimBatch(batchSize);
        } catch (RuntimeException e) {
            log.error("Could not read the outbox, retrying on next poll", e);
            return 0;
        }

        int published = 0;
        for (OutboxEvent event : batch) {
            if (publish(event)) {
                published++;
            }
        }
        if (!batch.isEmpty()) {
            log.info("Outbox batch: {} of {} events published", published, batch.size());
        }
        return published;
    }

    /**
     * Runs one batch immediately instead of waiting for the schedule.
     */
    public int triggerPublish() {
        return publishPendingEvents();
    }

    private boolean publish(OutboxEvent event) {
        if (event.getRetryCount() >= maxRetries) {
            log.warn("Dead letter {} ({} for transfer {}) after {} attempts: {}", event.getId(),
                    event.getEventType(), event.getAggregateId(), event.getRetryCount(), event.getLastError());
            outboxMetrics.record(event.getEventType(), Outcome.DEAD_LETTERED);
            return false;
        }

        try {
            RecordMetadata metadata = kafkaTemplate.send(toRecord(event))
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS)
                    .getRecordMetadata();
            log.debug("{} for transfer {} written to {}-{}@{}", event.getEventType(), event.getAggregateId(),
                    metadata.topic(), metadata.partition(), metadata.offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.record(event.getEventType(), Outcome.PUBLISHED);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return sendFailed(event, e);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            return sendFailed(event, e);
        }
    }

    private ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(transfersTopic, event.getAggregateId(), event.getPayload());
        record.headers()
                .add(HEADER_EVENT_ID, event.getId().toString().getBytes(StandardCharsets.UTF_8))
                .add(HEADER_EVENT_TYPE, event.getEventType().getBytes(StandardCharsets.UTF_8));
        return record;
    }

    private boolean sendFailed(OutboxEvent event, Exception e) {
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        log.error("Publishing {} for transfer {} failed: {}", event.getEventType(), event.getAggregateId(),
                cause.toString());
        outboxService.markFailed(event.getId(), cause.toString());
        outboxMetrics.record(event.getEventType(), Outcome.FAILED);
        return false;
    }
}
