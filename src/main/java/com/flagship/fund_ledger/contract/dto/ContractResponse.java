package com.flagship.fund_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.contract.Contract;
import com.flagship.fund_ledger.contract.ContractInstallment;
import com.flagship.fund_ledger.contract.ContractStatus;
import com.flagship.fund_ledger.contract.ContractType;
import com.flagship.fund_ledger.contract.InstallmentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ContractResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("site_id")
    UUID siteId;

    @JsonProperty("created_by")
    UUID createdBy;

    @JsonProperty("fund_allocation_id")
    UUID fundAllocationId;

    @JsonProperty("contract_type")
    ContractType contractType;

    @JsonProperty("title")
    String title;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("total_paid")
    BigDecimal totalPaid;

    @JsonProperty("remaining_amount")
    BigDecimal remainingAmount;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("status")
    ContractStatus status;

    @JsonProperty("installments")
    List<Installment> installments;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ContractResponse from(Contract contract) {
        return ContractResponse.builder()
            .id(contract.getId())
            .workerId(contract.getWorkerId())
            .siteId(contract.getSiteId())
            .createdBy(contract.getCreatedBy())
            .fundAllocationId(contract.getFundAllocationId())
            .contractType(contract.getContractType())
            .title(contract.getTitle())
            .totalAmount(contract.getTotalAmount())
            .totalPaid(contract.getTotalPaid())
            .remainingAmount(contract.remainingAmount())
            .startDate(contract.getStartDate())
            .endDate(contract.getEndDate())
            .status(contract.getStatus())
            .installments(contract.getInstallments().stream().map(Installment::from).toList())
            .createdAt(contract.getCreatedAt())
            .build();
    }

    @Value
    public static class Installment {
        @JsonProperty("installment_number")
        int installmentNumber;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("paid_amount")
        BigDecimal paidAmount;

        @JsonProperty("due_date")
        LocalDate dueDate;

        @JsonProperty("status")
        InstallmentStatus status;

        @JsonProperty("ledger_entry_id")
        UUID ledgerEntryId;

        static Installment from(ContractInstallment installment) {
            return new Installment(installment.getInstallmentNumber(), installment.getAmount(),
                installment.getPaidAmount(), installment.getDueDate(), installment.getStatus(),
                installment.getLedgerEntryId());
        }
    }
}
