package com.flagship.fund_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.ledger.EntryType;
import com.flagship.fund_ledger.ledger.LedgerCategory;
import com.flagship.fund_ledger.ledger.LedgerEntry;
import com.flagship.fund_ledger.ledger.LedgerStatus;
import com.flagship.fund_ledger.ledger.PaymentMode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

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

    @JsonProperty("contract_id")
    UUID contractId;

    @JsonProperty("linked_advance_id")
    UUID linkedAdvanceId;

    @JsonProperty("type")
    EntryType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("category")
    LedgerCategory category;

    @JsonProperty("status")
    LedgerStatus status;

    @JsonProperty("description")
    String description;

    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("payment_mode")
    PaymentMode paymentMode;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .workerId(entry.getWorkerId())
            .siteId(entry.getSiteId())
            .createdBy(entry.getCreatedBy())
            .fundAllocationId(entry.getFundAllocationId())
            .contractId(entry.getContractId())
            .linkedAdvanceId(entry.getLinkedAdvanceId())
            .type(entry.getType())
            .amount(entry.getAmount())
            .category(entry.getCategory())
            .status(entry.getStatus())
            .description(entry.getDescription())
            .transactionDate(entry.getTransactionDate())
            .referenceNumber(entry.getReferenceNumber())
            .paymentMode(entry.getPaymentMode())
            .paidAt(entry.getPaidAt())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
