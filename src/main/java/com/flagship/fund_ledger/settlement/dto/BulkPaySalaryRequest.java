package com.flagship.fund_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.ledger.PaymentMode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * An empty worker list is rejected by the service with EMPTY_SELECTION rather
 * than by bean validation, so both paths report the same error code.
 */
@Value
public class BulkPaySalaryRequest {

    @NotNull(message = "Workers are required")
    @JsonProperty("worker_ids")
    List<UUID> workerIds;

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
