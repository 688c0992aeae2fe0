package com.flagship.fund_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.ledger.PaymentMode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class UpdateLedgerEntryRequest {

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Amount supports at most two decimals")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 1000)
    @JsonProperty("description")
    String description;

    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @Size(max = 100)
    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("payment_mode")
    PaymentMode paymentMode;
}
