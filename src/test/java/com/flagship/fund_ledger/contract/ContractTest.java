package com.flagship.fund_ledger.contract;

import com.flagship.fund_ledger.common.exception.ErrorCode;
import com.flagship.fund_ledger.common.exception.InvalidStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ContractTest {

    private Contract draft(String total, int installments) {
        return Contract.create(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), null,
            null, "Plastering", null, new BigDecimal(total), installments, null,
            LocalDate.of(2026, 1, 1), LocalDate.of(2026, 4, 1));
    }

    @Test
    @DisplayName("Installments are equal parts and the last one absorbs rounding")
    void testGenerateInstallments_LastAbsorbsRounding() {
        Contract contract = draft("1000.00", 3);
        List<ContractInstallment> installments = contract.getInstallments();

        assertEquals(3, installments.size());
        assertEquals(new BigDecimal("333.33"), installments.get(0).getAmount());
        assertEquals(new BigDecimal("333.33"), installments.get(1).getAmount());
        assertEquals(new BigDecimal("333.34"), installments.get(2).getAmount());
        BigDecimal sum = installments.stream().map(ContractInstallment::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, sum.compareTo(new BigDecimal("1000.00")));
        assertEquals(ContractType.FIXED, contract.getContractType());
        assertEquals(ContractStatus.DRAFT, contract.getStatus());
    }

    @Test
    @DisplayName("Due dates spread across the contract period")
    void testGenerateInstallments_DueDates() {
        Contract contract = draft("900.00", 3);

        // 90 days between start and end
        assertEquals(LocalDate.of(2026, 1, 31), contract.getInstallments().get(0).getDueDate());
        assertEquals(LocalDate.of(2026, 4, 1), contract.getInstallments().get(2).getDueDate());
    }

    @Test
    @DisplayName("A draft contract does not accept payments")
    void testRecordPayment_Draft() {
        Contract contract = draft("1000.00", 2);

        InvalidStateException e = assertThrows(InvalidStateException.class,
            () -> contract.recordPayment(1, new BigDecimal("100.00"), UUID.randomUUID(), null));
        assertEquals(ErrorCode.CONTRACT_NOT_ACTIVE, e.getCode());
    }

    @Test
    @DisplayName("Partial then full payment completes the contract")
    void testRecordPayment_PartialThenComplete() {
        Contract active = draft("1000.00", 2).activate();

        Contract partial = active.recordPayment(1, new BigDecimal("200.00"), UUID.randomUUID(), "first");
        assertEquals(InstallmentStatus.PARTIAL, partial.getInstallments().get(0).getStatus());
        assertEquals(new BigDecimal("200.00"), partial.getTotalPaid());
        assertEquals(ContractStatus.ACTIVE, partial.getStatus());

        Contract done = partial
            .recordPayment(1, new BigDecimal("300.00"), UUID.randomUUID(), null)
            .recordPayment(2, new BigDecimal("500.00"), UUID.randomUUID(), null);
        assertEquals(InstallmentStatus.PAID, done.getInstallments().get(0).getStatus());
        assertEquals(InstallmentStatus.PAID, done.getInstallments().get(1).getStatus());
        assertEquals(ContractStatus.COMPLETED, done.getStatus());
        assertEquals(0, done.remainingAmount().signum());
        assertEquals("first", done.getInstallments().get(0).getNotes());
    }

    @Test
    @DisplayName("Overpaying an installment or paying an unknown one is rejected")
    void testRecordPayment_InvalidInstallment() {
        Contract active = draft("1000.00", 2).activate();

        assertThrows(IllegalArgumentException.class,
            () -> active.recordPayment(1, new BigDecimal("500.01"), UUID.randomUUID(), null));
        assertThrows(IllegalArgumentException.class,
            () -> active.recordPayment(3, new BigDecimal("1.00"), UUID.randomUUID(), null));
    }

    @Test
    @DisplayName("Only a draft can be activated")
    void testActivate_OnlyFromDraft() {
        Contract active = draft("1000.00", 1).activate();

        assertEquals(ContractStatus.ACTIVE, active.getStatus());
        assertThrows(InvalidStateException.class, active::activate);
    }
}
