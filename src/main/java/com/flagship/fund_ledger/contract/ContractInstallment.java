package com.flagship.fund_ledger.contract;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
public class ContractInstallment {
    int installmentNumber;
    BigDecimal amount;
    BigDecimal paidAmount;
    LocalDate dueDate;
    InstallmentStatus status;
    UUID ledgerEntryId;
    Instant paidAt;
    String notes;

    public BigDecimal remaining() {
        return amount.subtract(paidAmount);
    }

    ContractInstallment pay(BigDecimal payment, UUID entryId, String paymentNotes) {
        BigDecimal paid = paidAmount.add(payment);
        return toBuilder()
            .paidAmount(paid)
            .status(paid.compareTo(amount) >= 0 ? InstallmentStatus.PAID : InstallmentStatus.PARTIAL)
            .ledgerEntryId(entryId)
            .paidAt(Instant.now())
            .notes(paymentNotes != null ? paymentNotes : notes)
            .build();
    }
}
