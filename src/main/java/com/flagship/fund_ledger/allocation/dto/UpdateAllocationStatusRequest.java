package com.flagship.fund_ledger.allocation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.allocation.AllocationStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class UpdateAllocationStatusRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    AllocationStatus status;
}
