package com.flagship.fund_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class CreateLedgerEntryCommand {
    UUID workerId;
    UUID siteId;
    UUID fundAllocationId;
    UUID contractId;
    UUID linkedAdvanceId;
    EntryType type;
    BigDecimal amount;
    LedgerCategory category;
    LedgerStatus status;
    String description;
    LocalDate transactionDate;
    String referenceNumber;
    PaymentMode paymentMode;
}
