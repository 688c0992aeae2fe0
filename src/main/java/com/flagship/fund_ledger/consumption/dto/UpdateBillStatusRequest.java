package com.flagship.fund_ledger.consumption.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.consumption.BillStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class UpdateBillStatusRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    BillStatus status;
}
