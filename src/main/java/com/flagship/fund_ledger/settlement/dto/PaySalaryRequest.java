package com.flagship.fund_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.ledger.PaymentMode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
public class PaySalaryRequest {

    @NotNull(message = "Worker is required")
    @JsonProperty("worker_id")
    UUID workerId;

    @NotNull(message = "Fund allocation is required")
    @JsonProperty("fund_allocation_id")
    UUID fundAllocationId;

    @JsonProperty("site_id")
    UUID siteId;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("payment_mode")
    PaymentMode paymentMode;

    @Size(max = 100)
    @JsonProperty("reference_number")
    String referenceNumber;

    @Size(max = 1000)
    @JsonProperty("description")
    String description;
}
