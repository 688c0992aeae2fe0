package com.flagship.fund_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.ledger.PaymentMode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class ContractPaymentRequest {

    @NotNull(message = "Installment number is required")
    @Min(1)
    @JsonProperty("installment_number")
    Integer installmentNumber;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 17, fraction = 2)
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("fund_allocation_id")
    UUID fundAllocationId;

    @JsonProperty("payment_mode")
    PaymentMode paymentMode;

    @Size(max = 100)
    @JsonProperty("reference_number")
    String referenceNumber;

    @Size(max = 1000)
    @JsonProperty("notes")
    String notes;
}
