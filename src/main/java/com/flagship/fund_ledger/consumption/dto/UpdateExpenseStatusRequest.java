package com.flagship.fund_ledger.consumption.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.consumption.ExpenseStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class UpdateExpenseStatusRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    ExpenseStatus status;
}
