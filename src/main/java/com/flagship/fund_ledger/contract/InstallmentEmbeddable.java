package com.flagship.fund_ledger.contract;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Row of {@code contract_installments}, owned by {@link ContractEntity}.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InstallmentEmbeddable {

    @Column(name = "installment_number", nullable = false)
    private int installmentNumber;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "paid_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal paidAmount;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private InstallmentStatus status;

    @Column(name = "ledger_entry_id")
    private UUID ledgerEntryId;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "notes")
    private String notes;

    static InstallmentEmbeddable fromDomain(ContractInstallment installment) {
        return new InstallmentEmbeddable(
            installment.getInstallmentNumber(),
            installment.getAmount(),
            installment.getPaidAmount(),
            installment.getDueDate(),
            installment.getStatus(),
            installment.getLedgerEntryId(),
            installment.getPaidAt(),
            installment.getNotes()
        );
    }

    ContractInstallment toDomain() {
        return ContractInstallment.builder()
            .installmentNumber(installmentNumber)
            .amount(amount)
            .paidAmount(paidAmount)
            .dueDate(dueDate)
            .status(status)
            .ledgerEntryId(ledgerEntryId)
            .paidAt(paidAt)
            .notes(notes)
            .build();
    }
}
