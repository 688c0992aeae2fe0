package com.flagship.fund_ledger.allocation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.allocation.AllocationPurpose;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CreateAllocationRequest {

    @NotNull(message = "Recipient is required")
    @JsonProperty("to_user_id")
    UUID toUserId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Amount supports at most two decimals")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("purpose")
    AllocationPurpose purpose;

    @JsonProperty("site_id")
    UUID siteId;

    @Size(max = 1000)
    @JsonProperty("description")
    String description;

    @Size(max = 100)
    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("source_allocation_id")
    UUID sourceAllocationId;
}
