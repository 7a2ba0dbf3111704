package com.flagship.bank_transfer.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bank_transfer.ledger.LedgerStore;
import com.flagship.bank_transfer.ledger.Transfer;
import com.flagship.bank_transfer.ledger.event.TransferCompletedEvent;
import com.flagship.bank_transfer.ledger.event.TransferFailedEvent;
import com.flagship.bank_transfer.transfer.TransferEngine;
import com.flagship.bank_transfer.transfer.TransferResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox writes ride on the ledger transaction; publisher bookkeeping runs in its own.
 */
@SpringBootTest
@ActiveProfiles("test")
class OutboxServiceTest {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private TransferEngine transferEngine;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private ObjectMapper objectMapper;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    @Test
    @DisplayName("enqueue outside a transaction is refused")
    void testEnqueueRequiresTransaction() {
        printTestHeader("Outbox Write Requires Transaction");

        assertThrows(IllegalTransactionStateException.class, () -> outboxService.enqueue(completedEvent()));
    }

    @Test
    @DisplayName("An event queued in a rolled-back transaction disappears with it")
    void testRollbackDiscardsEvent() {
        TransferCompletedEvent event = completedEvent();
        TransactionTemplate tx = new TransactionTemplate(transactionManager);

        assertThrows(IllegalStateException.class, () -> tx.executeWithoutResult(status -> {
            outboxService.enqueue(event);
            throw new IllegalStateException("abort");
        }));

        assertTrue(outboxService.eventsForTransfer(event.getTransferId()).isEmpty());
    }

    @Test
    @DisplayName("The outbox row id is the event id and the payload is the event as JSON")
    void testQueuedEventShape() throws Exception {
        TransferCompletedEvent event = completedEvent();
        new TransactionTemplate(transactionManager).executeWithoutResult(status -> outboxService.enqueue(event));

        OutboxEvent queued = single(event.getTransferId());
        assertEquals(event.getEventId(), queued.getId());
        assertEquals(OutboxService.AGGREGATE_TRANSFER, queued.getAggregateType());
        assertEquals(TransferCompletedEvent.EVENT_TYPE, queued.getEventType());

        JsonNode payload = objectMapper.readTree(queued.getPayload());
        assertEquals(event.getTransferId(), payload.get("transferId").asText());
        assertEquals(0, new BigDecimal("12.50").compareTo(payload.get("fee").decimalValue()));
    }

    @Test
    @DisplayName("Completed and failed transfers each leave exactly one event")
    void testTransferOutcomesProduceEvents() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        String payer = "payer-" + suffix;
        String payee = "payee-" + suffix;
        ledgerStore.createUser(payer, "pw", null, new BigDecimal("100.00"));
        ledgerStore.createUser(payee, "pw", null);

        TransferResult completed = transferEngine.submitTransfer(payer, payee, "60.00", null);
        TransferResult failed = transferEngine.submitTransfer(payer, payee, "60.00", null);

        OutboxEvent completedEvent = single(completed.getTransferId());
        assertEquals(TransferCompletedEvent.EVENT_TYPE, completedEvent.getEventType());
        assertFalse(completedEvent.isPublished());

        OutboxEvent failedEvent = single(failed.getTransferId());
        assertEquals(TransferFailedEvent.EVENT_TYPE, failedEvent.getEventType());
        assertTrue(failedEvent.getPayload().contains(Transfer.REASON_INSUFFICIENT_FUNDS));
    }

    @Test
    @DisplayName("markFailed bumps the retry count; markPublished takes the event off the backlog")
    void testPublisherBookkeeping() {
        TransferCompletedEvent event = completedEvent();
        new TransactionTemplate(transactionManager).executeWithoutResult(status -> outboxService.enqueue(event));

        outboxService.markFailed(event.getEventId(), "broker down");
        outboxService.markFailed(event.getEventId(), "still down");

        OutboxEvent afterFailures = single(event.getTransferId());
        assertEquals(2, afterFailures.getRetryCount());
        assertEquals("still down", afterFailures.getLastError());
        assertNotNull(afterFailures.getLastAttemptAt());
        assertFalse(afterFailures.isPublished());

        long backlog = outboxService.countUnpublished();
        outboxService.markPublished(event.getEventId());

        OutboxEvent published = single(event.getTransferId());
        assertTrue(published.isPublished());
        assertNull(published.getLastError());
        assertEquals(backlog - 1, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Events past the retry limit count as dead letters")
    void testDeadLetterCount() {
        TransferCompletedEvent event = completedEvent();
        new TransactionTemplate(transactionManager).executeWithoutResult(status -> outboxService.enqueue(event));

        long before = outboxService.countDeadLetters(2);
        outboxService.markFailed(event.getEventId(), "e1");
        outboxService.markFailed(event.getEventId(), "e2");

        assertEquals(before + 1, outboxService.countDeadLetters(2));
    }

    @Test
    @DisplayName("Marking an unknown event is a no-op")
    void testUnknownEvent() {
        assertDoesNotThrow(() -> outboxService.markPublished(UUID.randomUUID()));
        assertDoesNotThrow(() -> outboxService.markFailed(UUID.randomUUID(), "gone"));
    }

    private static TransferCompletedEvent completedEvent() {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        Transfer transfer = Transfer.create("alice", "bob", new BigDecimal("5000.00"), new BigDecimal("12.50"),
                null, now).complete(now);
        return TransferCompletedEvent.fromTransfer(transfer);
    }

    private OutboxEvent single(String transferId) {
        List<OutboxEvent> events = outboxService.eventsForTransfer(transferId);
        assertEquals(1, events.size());
        return events.get(0);
    }
}
