package com.flagship.fund_ledger.contract;

import com.flagship.fund_ledger.common.Amounts;
import com.flagship.fund_ledger.common.exception.ErrorCode;
import com.flagship.fund_ledger.common.exception.InvalidStateException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A worker contract paid out in installments through the worker ledger.
 *
 * Installments are generated once, on creation, as equal parts of the total
 * rounded down to cents. The last installment absorbs the rounding, so the
 * installments always sum to the total.
 */
@Value
@Builder(toBuilder = true)
public class Contract {
    UUID id;
    UUID organizationId;
    UUID workerId;
    UUID siteId;
    UUID createdBy;
    UUID fundAllocationId;
    ContractType contractType;
    String title;
    String description;
    BigDecimal totalAmount;
    BigDecimal totalPaid;
    int numberOfInstallments;
    BigDecimal dailyRate;
    LocalDate startDate;
    LocalDate endDate;
    ContractStatus status;
    List<ContractInstallment> installments;
    Instant createdAt;
    Instant updatedAt;

    public static Contract create(UUID organizationId, UUID workerId, UUID siteId, UUID createdBy,
                                  UUID fundAllocationId, ContractType type, String title, String description,
                                  BigDecimal totalAmount, int numberOfInstallments, BigDecimal dailyRate,
                                  LocalDate startDate, LocalDate endDate) {
        if (numberOfInstallments < 1) {
            throw new IllegalArgumentException("numberOfInstallments must be at least 1");
        }
        if (endDate != null && endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }
        Instant now = Instant.now();
        return Contract.builder()
            .id(UUID.randomUUID())
            .organizationId(organizationId)
            .workerId(workerId)
            .siteId(siteId)
            .createdBy(createdBy)
            .fundAllocationId(fundAllocationId)
            .contractType(type != null ? type : ContractType.FIXED)
            .title(title)
            .description(description)
            .totalAmount(totalAmount)
            .totalPaid(Amounts.zero())
            .numberOfInstallments(numberOfInstallments)
            .dailyRate(dailyRate)
            .startDate(startDate)
            .endDate(endDate)
            .status(ContractStatus.DRAFT)
            .installments(generateInstallments(totalAmount, numberOfInstallments, startDate, endDate))
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    static List<ContractInstallment> generateInstallments(BigDecimal total, int count,
                                                          LocalDate startDate, LocalDate endDate) {
        BigDecimal share = total.divide(BigDecimal.valueOf(count), Amounts.SCALE, RoundingMode.DOWN);
        BigDecimal last = total.subtract(share.multiply(BigDecimal.valueOf(count - 1)));
        long intervalDays = startDate != null && endDate != null
            ? ChronoUnit.DAYS.between(startDate, endDate) / count
            : -1;

        List<ContractInstallment> installments = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            installments.add(ContractInstallment.builder()
                .installmentNumber(i)
                .amount(i == count ? Amounts.normalize(last) : share)
                .paidAmount(Amounts.zero())
                .dueDate(intervalDays >= 0 ? startDate.plusDays(intervalDays * i) : null)
                .status(InstallmentStatus.PENDING)
                .build());
        }
        return installments;
    }

    /**
     * @throws InvalidStateException unless the contract is a draft
     */
    public Contract activate() {
        if (status != ContractStatus.DRAFT) {
            throw InvalidStateException.invalidTransition(id, status, ContractStatus.ACTIVE);
        }
        return toBuilder().status(ContractStatus.ACTIVE).updatedAt(Instant.now()).build();
    }

    /**
     * Checks that a payment can be applied before any money moves.
     *
     * @throws InvalidStateException with CONTRACT_NOT_ACTIVE unless the contract is active
     * @throws IllegalArgumentException if the installment does not exist or the payment exceeds what it still owes
     */
    public ContractInstallment requirePayable(int installmentNumber, BigDecimal payment) {
        if (status != ContractStatus.ACTIVE) {
            throw new InvalidStateException(ErrorCode.CONTRACT_NOT_ACTIVE,
                "Contract must be active to record payments",
                Map.of("contractId", id, "status", status));
        }
        ContractInstallment installment = installment(installmentNumber);
        if (payment.compareTo(installment.remaining()) > 0) {
            throw new IllegalArgumentException(String.format(
                "Payment %s exceeds the %s still owed on installment %d",
                payment, installment.remaining(), installmentNumber));
        }
        return installment;
    }

    /**
     * Applies a payment that {@link #requirePayable} accepted. The contract
     * completes once the installments add up to the total.
     */
    public Contract recordPayment(int installmentNumber, BigDecimal payment, UUID ledgerEntryId, String notes) {
        requirePayable(installmentNumber, payment);

        List<ContractInstallment> updated = new ArrayList<>(installments.size());
        for (ContractInstallment installment : installments) {
            updated.add(installment.getInstallmentNumber() == installmentNumber
                ? installment.pay(payment, ledgerEntryId, notes)
                : installment);
        }
        BigDecimal paid = updated.stream()
            .map(ContractInstallment::getPaidAmount)
            .reduce(Amounts.zero(), BigDecimal::add);

        return toBuilder()
            .installments(List.copyOf(updated))
            .totalPaid(paid)
            .status(paid.compareTo(totalAmount) >= 0 ? ContractStatus.COMPLETED : status)
            .updatedAt(Instant.now())
            .build();
    }

    public BigDecimal remainingAmount() {
        return totalAmount.subtract(totalPaid);
    }

    private ContractInstallment installment(int installmentNumber) {
        return installments.stream()
            .filter(installment -> installment.getInstallmentNumber() == installmentNumber)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Installment " + installmentNumber + " does not exist on contract " + id));
    }
}
