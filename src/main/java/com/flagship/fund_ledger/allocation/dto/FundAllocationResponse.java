package com.flagship.fund_ledger.allocation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.allocation.AllocationPurpose;
import com.flagship.fund_ledger.allocation.AllocationStatus;
import com.flagship.fund_ledger.allocation.FundAllocation;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class FundAllocationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("from_user_id")
    UUID fromUserId;

    @JsonProperty("to_user_id")
    UUID toUserId;

    @JsonProperty("site_id")
    UUID siteId;

    @JsonProperty("source_allocation_id")
    UUID sourceAllocationId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("purpose")
    AllocationPurpose purpose;

    @JsonProperty("description")
    String description;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("status")
    AllocationStatus status;

    @JsonProperty("allocation_date")
    LocalDate allocationDate;

    @JsonProperty("disbursed_at")
    Instant disbursedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static FundAllocationResponse from(FundAllocation allocation) {
        return FundAllocationResponse.builder()
            .id(allocation.getId())
            .fromUserId(allocation.getFromUserId())
            .toUserId(allocation.getToUserId())
            .siteId(allocation.getSiteId())
            .sourceAllocationId(allocation.getSourceAllocationId())
            .amount(allocation.getAmount())
            .purpose(allocation.getPurpose())
            .description(allocation.getDescription())
            .referenceNumber(allocation.getReferenceNumber())
            .status(allocation.getStatus())
            .allocationDate(allocation.getAllocationDate())
            .disbursedAt(allocation.getDisbursedAt())
            .createdAt(allocation.getCreatedAt())
            .updatedAt(allocation.getUpdatedAt())
            .build();
    }
}
