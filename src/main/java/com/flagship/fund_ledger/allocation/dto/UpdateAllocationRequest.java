package com.flagship.fund_ledger.allocation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.allocation.AllocationPurpose;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Partial update; absent fields keep their current value.
 */
@Value
public class UpdateAllocationRequest {

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Amount supports at most two decimals")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("purpose")
    AllocationPurpose purpose;

    @Size(max = 1000)
    @JsonProperty("description")
    String description;
}
