package com.flagship.fund_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.contract.ContractType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class CreateContractRequest {

    @NotNull(message = "Worker is required")
    @JsonProperty("worker_id")
    UUID workerId;

    @NotNull(message = "Site is required")
    @JsonProperty("site_id")
    UUID siteId;

    @JsonProperty("fund_allocation_id")
    UUID fundAllocationId;

    @JsonProperty("contract_type")
    ContractType contractType;

    @NotBlank(message = "Title is required")
    @Size(max = 200)
    @JsonProperty("title")
    String title;

    @Size(max = 1000)
    @JsonProperty("description")
    String description;

    @NotNull(message = "Total amount is required")
    @DecimalMin(value = "0.01", message = "Total amount must be greater than 0")
    @Digits(integer = 17, fraction = 2)
    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @Min(1)
    @Max(120)
    @JsonProperty("number_of_installments")
    Integer numberOfInstallments;

    @DecimalMin("0.00")
    @JsonProperty("daily_rate")
    BigDecimal dailyRate;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;
}
