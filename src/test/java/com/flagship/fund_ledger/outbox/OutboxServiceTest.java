package com.flagship.fund_ledger.outbox;

import com.flagship.fund_ledger.allocation.FundAllocation;
import com.flagship.fund_ledger.allocation.FundAllocationService;
import com.flagship.fund_ledger.identity.DirectoryService;
import com.flagship.fund_ledger.support.OrganizationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox writes and bookkeeping.
 *
 * These tests verify that:
 * - Events are only written inside a business transaction
 * - A rolled back business write leaves no event behind
 * - Published and failed events are tracked
 */
@SpringBootTest
@ActiveProfiles("test")
class OutboxServiceTest {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private FundAllocationService allocationService;

    @Autowired
    private DirectoryService directoryService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private OrganizationFixture org;
    private TransactionTemplate transactionTemplate;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    @BeforeEach
    void setUp() {
        org = new OrganizationFixture(directoryService, allocationService);
        transactionTemplate = new TransactionTemplate(transactionManager);
    }

    private OutboxEvent saveInTransaction(UUID aggregateId) {
        return transactionTemplate.execute(status -> outboxService.saveEvent(
            OutboxPublisher.SETTLEMENT_AGGREGATE, aggregateId, "SalarySettled", Map.of("workerId", aggregateId)));
    }

    @Test
    @DisplayName("Saving an event outside a transaction fails fast")
    void testSaveEvent_RequiresTransaction() {
        printTestHeader("Save event outside a transaction");
        UUID aggregateId = UUID.randomUUID();

        IllegalTransactionStateException e = assertThrows(IllegalTransactionStateException.class,
            () -> outboxService.saveEvent(OutboxPublisher.SETTLEMENT_AGGREGATE, aggregateId, "SalarySettled", Map.of()));
        printExpectedException("IllegalTransactionStateException", e.getMessage());

        assertTrue(outboxService.getEventsForAggregate(OutboxPublisher.SETTLEMENT_AGGREGATE, aggregateId).isEmpty());
    }

    @Test
    @DisplayName("An event is stored as JSON with its aggregate key")
    void testSaveEvent_InTransaction() {
        UUID aggregateId = UUID.randomUUID();
        OutboxEvent saved = saveInTransaction(aggregateId);
        printOutput("Event", saved);

        List<OutboxEvent> events = outboxService.getEventsForAggregate(OutboxPublisher.SETTLEMENT_AGGREGATE, aggregateId);
        assertEquals(1, events.size());
        assertEquals(saved.getId(), events.get(0).getId());
        assertTrue(events.get(0).getPayload().contains(aggregateId.toString()));
        assertFalse(events.get(0).isPublished());
        assertEquals(0, events.get(0).getRetryCount());
    }

    @Test
    @DisplayName("An event disappears with its rolled back transaction")
    void testSaveEvent_RolledBackWithBusinessWrite() {
        UUID aggregateId = UUID.randomUUID();

        transactionTemplate.executeWithoutResult(status -> {
            outboxService.saveEvent(OutboxPublisher.SETTLEMENT_AGGREGATE, aggregateId, "SalarySettled", Map.of());
            status.setRollbackOnly();
        });

        assertTrue(outboxService.getEventsForAggregate(OutboxPublisher.SETTLEMENT_AGGREGATE, aggregateId).isEmpty());
    }

    @Test
    @DisplayName("Published events leave the backlog; failed events count their retries")
    void testMarkPublishedAndFailed() {
        printTestHeader("Mark published and failed");
        FundAllocation allocation = org.disburse(org.engineerId, "100.00");
        List<OutboxEvent> events = outboxService.getEventsForAggregate(OutboxPublisher.ALLOCATION_AGGREGATE, allocation.getId());
        assertEquals(1, events.size());
        OutboxEvent created = events.get(0);

        outboxService.markFailed(created.getId(), "broker unavailable");
        outboxService.markFailed(created.getId(), "broker unavailable");
        OutboxEventEntity failed = outboxEventRepository.findById(created.getId()).orElseThrow();
        assertEquals(2, failed.getRetryCount());
        assertEquals("broker unavailable", failed.getLastError());
        assertNull(failed.getPublishedAt());

        long before = outboxService.countUnpublished();
        outboxService.markPublished(created.getId());

        assertNotNull(outboxEventRepository.findById(created.getId()).orElseThrow().getPublishedAt());
        assertEquals(before - 1, outboxService.countUnpublished());
    }
}
