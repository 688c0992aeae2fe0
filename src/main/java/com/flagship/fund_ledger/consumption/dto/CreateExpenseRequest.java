package com.flagship.fund_ledger.consumption.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class CreateExpenseRequest {

    @NotNull(message = "Site is required")
    @JsonProperty("site_id")
    UUID siteId;

    @NotNull(message = "Fund allocation is required. Please select a fund allocation for this expense.")
    @JsonProperty("fund_allocation_id")
    UUID fundAllocationId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Amount supports at most two decimals")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 1000)
    @JsonProperty("description")
    String description;

    @Size(max = 200)
    @JsonProperty("vendor_name")
    String vendorName;

    @JsonProperty("expense_date")
    LocalDate expenseDate;
}
