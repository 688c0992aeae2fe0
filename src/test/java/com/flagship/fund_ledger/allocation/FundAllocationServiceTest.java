package com.flagship.fund_ledger.allocation;

import com.flagship.fund_ledger.common.dto.PagedResponse;
import com.flagship.fund_ledger.common.exception.ErrorCode;
import com.flagship.fund_ledger.common.exception.ForbiddenException;
import com.flagship.fund_ledger.common.exception.InsufficientFundsException;
import com.flagship.fund_ledger.common.exception.InvalidStateException;
import com.flagship.fund_ledger.common.exception.NotFoundException;
import com.flagship.fund_ledger.consumption.CreateExpenseCommand;
import com.flagship.fund_ledger.consumption.ExpenseService;
import com.flagship.fund_ledger.identity.DirectoryService;
import com.flagship.fund_ledger.outbox.OutboxEvent;
import com.flagship.fund_ledger.outbox.OutboxPublisher;
import com.flagship.fund_ledger.outbox.OutboxService;
import com.flagship.fund_ledger.support.OrganizationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Allocation lifecycle through the service.
 *
 * These tests verify that:
 * - Creation is gated by role, hierarchy and funding
 * - Only the recipient confirms disbursement, and funding is re-checked then
 * - Referenced allocations cannot be deleted
 * - Listing respects what each role may see
 */
@SpringBootTest
@ActiveProfiles("test")
class FundAllocationServiceTest {

    @Autowired
    private FundAllocationService allocationService;

    @Autowired
    private ExpenseService expenseService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private DirectoryService directoryService;

    private OrganizationFixture org;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    @BeforeEach
    void setUp() {
        org = new OrganizationFixture(directoryService, allocationService);
    }

    private CreateAllocationCommand allocate(UUID toUserId, String amount) {
        return CreateAllocationCommand.builder()
            .toUserId(toUserId)
            .amount(new BigDecimal(amount))
            .build();
    }

    @Test
    @DisplayName("Developer allocation is disbursed immediately and emits an outbox event")
    void testCreateAllocation_Developer() {
        printTestHeader("Developer allocation");

        FundAllocation allocation = org.disburse(org.engineerId, "2500.00");

        assertEquals(AllocationStatus.DISBURSED, allocation.getStatus());
        assertEquals(org.developerId, allocation.getFromUserId());
        assertEquals(new BigDecimal("2500.00"), allocation.getAmount());

        List<OutboxEvent> events = outboxService.getEventsForAggregate(
            OutboxPublisher.ALLOCATION_AGGREGATE, allocation.getId());
        assertEquals(1, events.size());
        assertEquals("FundAllocationCreated", events.get(0).getEventType());
    }

    @Test
    @DisplayName("Workers cannot allocate and nobody allocates outside their hierarchy")
    void testCreateAllocation_Authority() {
        printTestHeader("Allocation authority");
        org.disburse(org.supervisorId, "1000.00");

        assertThrows(ForbiddenException.class,
            () -> allocationService.createAllocation(org.worker1(), allocate(org.worker2Id, "10.00")));
        assertThrows(ForbiddenException.class,
            () -> allocationService.createAllocation(org.supervisor(), allocate(org.engineerId, "10.00")));
        assertThrows(NotFoundException.class,
            () -> allocationService.createAllocation(org.supervisor(), allocate(UUID.randomUUID(), "10.00")));
        printExpectedException("ForbiddenException / NotFoundException", "recipient outside caller's authority");
    }

    @Test
    @DisplayName("An engineer cannot allocate more than their wallet holds")
    void testCreateAllocation_WalletShortfall() {
        printTestHeader("Wallet shortfall");
        org.disburse(org.engineerId, "1000.00");

        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> allocationService.createAllocation(org.engineer(), allocate(org.supervisorId, "1000.01")));
        printExpectedException("InsufficientFundsException", e.getMessage());

        assertEquals(new BigDecimal("1000.00"), e.getAvailable());
        PagedResponse<FundAllocation> sent = allocationService.listAllocations(
            org.developer(), null, null, org.engineerId, null, 1, 50);
        assertEquals(0, sent.getTotal());
    }

    @Test
    @DisplayName("A self-allocation cannot name a source allocation")
    void testCreateAllocation_SelfWithSource() {
        FundAllocation funding = org.disburse(org.engineerId, "1000.00");

        assertThrows(IllegalArgumentException.class,
            () -> allocationService.createAllocation(org.engineer(), CreateAllocationCommand.builder()
                .toUserId(org.engineerId)
                .amount(new BigDecimal("100.00"))
                .sourceAllocationId(funding.getId())
                .build()));
    }

    @Test
    @DisplayName("A sub-allocation cannot exceed what remains of its source")
    void testCreateAllocation_SourceShortfall() {
        FundAllocation funding = org.disburse(org.engineerId, "1000.00");

        CreateAllocationCommand tooMuch = CreateAllocationCommand.builder()
            .toUserId(org.supervisorId)
            .amount(new BigDecimal("1200.00"))
            .sourceAllocationId(funding.getId())
            .build();

        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> allocationService.createAllocation(org.engineer(), tooMuch));
        assertEquals(funding.getId().toString(), e.getDetails().get("allocationId"));
    }

    @Test
    @DisplayName("Only the recipient confirms disbursement, and only a developer approves or rejects")
    void testSetAllocationStatus_Permissions() {
        printTestHeader("Status permissions");
        org.disburse(org.engineerId, "1000.00");
        FundAllocation pending = allocationService.createAllocation(org.engineer(), allocate(org.supervisorId, "400.00"));

        assertThrows(ForbiddenException.class,
            () -> allocationService.setAllocationStatus(org.engineer(), pending.getId(), AllocationStatus.DISBURSED));
        assertThrows(ForbiddenException.class,
            () -> allocationService.setAllocationStatus(org.supervisor(), pending.getId(), AllocationStatus.APPROVED));

        FundAllocation approved = allocationService.setAllocationStatus(org.developer(), pending.getId(), AllocationStatus.APPROVED);
        assertEquals(AllocationStatus.APPROVED, approved.getStatus());

        FundAllocation disbursed = allocationService.setAllocationStatus(org.supervisor(), pending.getId(), AllocationStatus.DISBURSED);
        assertEquals(AllocationStatus.DISBURSED, disbursed.getStatus());
        assertNotNull(disbursed.getDisbursedAt());

        InvalidStateException e = assertThrows(InvalidStateException.class,
            () -> allocationService.setAllocationStatus(org.developer(), pending.getId(), AllocationStatus.REJECTED));
        assertEquals(ErrorCode.INVALID_TRANSITION, e.getCode());

        assertEquals(3, outboxService.getEventsForAggregate(OutboxPublisher.ALLOCATION_AGGREGATE, pending.getId()).size());
    }

    @Test
    @DisplayName("Disbursing re-checks the creator's wallet")
    void testSetAllocationStatus_RechecksWallet() {
        printTestHeader("Disbursement re-check");
        org.disburse(org.engineerId, "1000.00");

        FundAllocation first = allocationService.createAllocation(org.engineer(), allocate(org.supervisorId, "800.00"));
        FundAllocation second = allocationService.createAllocation(org.engineer(), allocate(org.worker1Id, "600.00"));

        allocationService.setAllocationStatus(org.supervisor(), first.getId(), AllocationStatus.DISBURSED);

        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> allocationService.setAllocationStatus(org.worker1(), second.getId(), AllocationStatus.DISBURSED));
        printExpectedException("InsufficientFundsException", e.getMessage());

        assertEquals(AllocationStatus.PENDING, allocationService.getAllocation(org.developer(), second.getId()).getStatus());
    }

    @Test
    @DisplayName("Deletion is developer-only and blocked while the allocation is referenced")
    void testDeleteAllocation() {
        printTestHeader("Delete allocation");
        FundAllocation used = org.disburse(org.engineerId, "1000.00");
        FundAllocation unused = org.disburse(org.supervisorId, "500.00");
        expenseService.createExpense(org.engineer(), CreateExpenseCommand.builder()
            .siteId(org.siteId)
            .fundAllocationId(used.getId())
            .amount(new BigDecimal("50.00"))
            .build());

        assertThrows(ForbiddenException.class, () -> allocationService.deleteAllocation(org.engineer(), unused.getId()));

        InvalidStateException e = assertThrows(InvalidStateException.class,
            () -> allocationService.deleteAllocation(org.developer(), used.getId()));
        assertEquals(ErrorCode.ALLOCATION_IN_USE, e.getCode());

        allocationService.deleteAllocation(org.developer(), unused.getId());
        assertThrows(NotFoundException.class, () -> allocationService.getAllocation(org.developer(), unused.getId()));
    }

    @Test
    @DisplayName("Edits are allowed for the creator until disbursement")
    void testUpdateAllocation() {
        org.disburse(org.engineerId, "1000.00");
        FundAllocation pending = allocationService.createAllocation(org.engineer(), allocate(org.supervisorId, "300.00"));

        FundAllocation edited = allocationService.updateAllocation(org.engineer(), pending.getId(),
            new BigDecimal("350.00"), AllocationPurpose.MATERIAL, "Bricks");
        assertEquals(new BigDecimal("350.00"), edited.getAmount());
        assertEquals("Bricks", edited.getDescription());

        assertThrows(ForbiddenException.class, () -> allocationService.updateAllocation(org.supervisor(),
            pending.getId(), new BigDecimal("1.00"), null, null));

        FundAllocation disbursed = org.disburse(org.supervisorId, "10.00");
        assertThrows(InvalidStateException.class, () -> allocationService.updateAllocation(org.developer(),
            disbursed.getId(), new BigDecimal("20.00"), null, null));
    }

    @Test
    @DisplayName("Workers see only what they received; engineers see what they sent and received")
    void testListAllocations_Visibility() {
        printTestHeader("List visibility");
        org.disburse(org.engineerId, "1000.00");
        org.disburse(org.worker1Id, "20.00");
        allocationService.createAllocation(org.engineer(), allocate(org.supervisorId, "100.00"));

        PagedResponse<FundAllocation> workerView = allocationService.listAllocations(
            org.worker1(), null, null, null, null, 1, 50);
        PagedResponse<FundAllocation> engineerView = allocationService.listAllocations(
            org.engineer(), null, null, null, null, 1, 50);
        PagedResponse<FundAllocation> developerView = allocationService.listAllocations(
            org.developer(), null, null, null, null, 1, 2);

        assertEquals(1, workerView.getTotal());
        assertEquals(2, engineerView.getTotal());
        assertEquals(3, developerView.getTotal());
        assertEquals(2, developerView.getData().size());
        assertEquals(2, developerView.getPages());

        PagedResponse<FundAllocation> pendingOnly = allocationService.listAllocations(
            org.developer(), AllocationStatus.PENDING, null, null, null, 1, 50);
        assertEquals(1, pendingOnly.getTotal());

        assertThrows(IllegalArgumentException.class,
            () -> allocationService.listAllocations(org.developer(), null, null, null, null, 0, 50));
    }

    @Test
    @DisplayName("Fund summary separates received, passed on and still pending")
    void testGetFundSummary() {
        org.disburse(org.engineerId, "1000.00");
        org.disburse(org.engineerId, "500.00");
        FundAllocation toSupervisor = allocationService.createAllocation(org.engineer(), allocate(org.supervisorId, "200.00"));
        allocationService.setAllocationStatus(org.supervisor(), toSupervisor.getId(), AllocationStatus.DISBURSED);
        allocationService.createAllocation(org.developer(), allocate(org.engineerId, "50.00"));

        FundSummary summary = allocationService.getFundSummary(org.engineer());

        // the last developer allocation is disbursed on creation too
        assertEquals(new BigDecimal("1550.00"), summary.getTotalReceived());
        assertEquals(3, summary.getReceivedCount());
        assertEquals(new BigDecimal("200.00"), summary.getTotalDisbursed());
        assertEquals(1, summary.getDisbursedCount());
        assertEquals(new BigDecimal("0.00"), summary.getPendingToReceive());
        assertEquals(new BigDecimal("1350.00"), summary.getWalletBalance());
    }
}
