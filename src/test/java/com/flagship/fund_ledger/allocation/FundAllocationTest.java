package com.flagship.fund_ledger.allocation;

import com.flagship.fund_ledger.common.exception.ErrorCode;
import com.flagship.fund_ledger.common.exception.InvalidStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Allocation state machine, without Spring.
 */
class FundAllocationTest {

    private final UUID organizationId = UUID.randomUUID();
    private final UUID from = UUID.randomUUID();
    private final UUID to = UUID.randomUUID();

    private FundAllocation pending() {
        return FundAllocation.create(organizationId, from, to, null, null, new BigDecimal("1000.00"),
            null, "Cement", null, false);
    }

    @Test
    @DisplayName("Developer allocations start disbursed, others start pending")
    void testCreate_InitialStatus() {
        FundAllocation auto = FundAllocation.create(organizationId, from, to, null, null, new BigDecimal("10.00"),
            AllocationPurpose.MATERIAL, null, null, true);

        assertEquals(AllocationStatus.DISBURSED, auto.getStatus());
        assertNotNull(auto.getDisbursedAt());
        assertEquals(AllocationStatus.PENDING, pending().getStatus());
        assertNull(pending().getDisbursedAt());
        assertEquals(AllocationPurpose.SITE_EXPENSE, pending().getPurpose());
    }

    @Test
    @DisplayName("PENDING -> APPROVED -> DISBURSED is allowed and stamps disbursedAt")
    void testTransition_HappyPath() {
        FundAllocation approved = pending().transitionTo(AllocationStatus.APPROVED);
        FundAllocation disbursed = approved.transitionTo(AllocationStatus.DISBURSED);

        assertEquals(AllocationStatus.APPROVED, approved.getStatus());
        assertNull(approved.getDisbursedAt());
        assertEquals(AllocationStatus.DISBURSED, disbursed.getStatus());
        assertNotNull(disbursed.getDisbursedAt());
    }

    @Test
    @DisplayName("Terminal statuses reject every further transition")
    void testTransition_FromTerminal() {
        FundAllocation rejected = pending().transitionTo(AllocationStatus.REJECTED);
        FundAllocation disbursed = pending().transitionTo(AllocationStatus.DISBURSED);

        InvalidStateException e = assertThrows(InvalidStateException.class,
            () -> rejected.transitionTo(AllocationStatus.DISBURSED));
        assertEquals(ErrorCode.INVALID_TRANSITION, e.getCode());
        assertThrows(InvalidStateException.class, () -> disbursed.transitionTo(AllocationStatus.REJECTED));
        assertFalse(disbursed.canTransitionTo(AllocationStatus.DISBURSED));
    }

    @Test
    @DisplayName("Terms can change until the allocation is disbursed")
    void testWithTerms() {
        FundAllocation edited = pending().withTerms(new BigDecimal("1500.00"), AllocationPurpose.EQUIPMENT, null);

        assertEquals(new BigDecimal("1500.00"), edited.getAmount());
        assertEquals(AllocationPurpose.EQUIPMENT, edited.getPurpose());
        assertEquals("Cement", edited.getDescription());

        FundAllocation disbursed = edited.transitionTo(AllocationStatus.DISBURSED);
        assertThrows(InvalidStateException.class, () -> disbursed.withTerms(BigDecimal.ONE, null, null));
    }

    @Test
    @DisplayName("An allocation to oneself is a self-allocation")
    void testSelfAllocation() {
        FundAllocation self = FundAllocation.create(organizationId, from, from, null, null, BigDecimal.TEN,
            null, null, null, true);

        assertTrue(self.isSelfAllocation());
        assertFalse(pending().isSelfAllocation());
    }
}
