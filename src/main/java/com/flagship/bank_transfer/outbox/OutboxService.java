package com.flagship.bank_transfer.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bank_transfer.ledger.event.TransferEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Transactional outbox for transfer events.
 *
 * {@link #enqueue} joins the ledger transaction that finalizes the transfer, so
 * an event exists exactly when its outcome was committed. The publisher-facing
 * methods each run in their own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String AGGREGATE_TRANSFER = "Transfer";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Queues a transfer event in the caller's transaction.
     *
     * @throws org.springframework.transaction.IllegalTransactionStateException if there is none
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent enqueue(TransferEvent event) {
        OutboxEvent queued = OutboxEvent.of(event, toJson(event), clock.instant());
        repository.save(OutboxEventEntity.fromDomain(queued));

        log.debug("Queued {} for transfer {}", queued.getEventType(), queued.getAggregateId());
        return queued;
    }

    /**
     * Locks and returns the oldest unpublished events. Rows locked by another
     * publisher instance are skipped.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> claimBatch(int limit) {
        return repository.findUnpublishedForUpdate(PageRequest.of(0, limit))
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        update(eventId, entity -> entity.markPublished(clock.instant()));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        update(eventId, entity -> {
            entity.markFailed(errorMessage, clock.instant());
            log.warn("Event {} failed to publish (attempt {}): {}", eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Events of one transfer in the order they were queued.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> eventsForTransfer(String transferId) {
        return repository.findByAggregateTypeAndAggregateIdOrderByCreatedAtAsc(AGGREGATE_TRANSFER, transferId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    @Transactional(readOnly = true)
    public long countDeadLetters(int maxRetries) {
        return repository.countDeadLetters(maxRetries);
    }

    /**
     * Age of the oldest unpublished event in whole seconds, 0 when nothing is waiting.
     */
    @Transactional(readOnly = true)
    public long oldestUnpublishedAgeSeconds() {
        Instant now = clock.instant();
        return repository.findOldestUnpublishedCreatedAt()
                .map(createdAt -> Math.max(0, Duration.between(createdAt, now).getSeconds()))
                .orElse(0L);
    }

    private void update(UUID eventId, Consumer<OutboxEventEntity> change) {
        repository.findById(eventId).ifPresentOrElse(
                change,
                () -> log.warn("Outbox event {} no longer exists", eventId));
    }

    private String toJson(TransferEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + event.getEventType(), e);
        }
    }
}
