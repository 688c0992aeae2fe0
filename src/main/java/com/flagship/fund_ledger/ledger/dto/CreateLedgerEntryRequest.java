package com.flagship.fund_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.ledger.EntryType;
import com.flagship.fund_ledger.ledger.LedgerCategory;
import com.flagship.fund_ledger.ledger.LedgerStatus;
import com.flagship.fund_ledger.ledger.PaymentMode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class CreateLedgerEntryRequest {

    @NotNull(message = "Worker is required")
    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("site_id")
    UUID siteId;

    @JsonProperty("fund_allocation_id")
    UUID fundAllocationId;

    @JsonProperty("contract_id")
    UUID contractId;

    @JsonProperty("linked_advance_id")
    UUID linkedAdvanceId;

    @NotNull(message = "Type is required")
    @JsonProperty("type")
    EntryType type;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Amount supports at most two decimals")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Category is required")
    @JsonProperty("category")
    LedgerCategory category;

    @JsonProperty("status")
    LedgerStatus status;

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
