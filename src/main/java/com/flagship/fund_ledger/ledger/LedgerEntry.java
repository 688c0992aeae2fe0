package com.flagship.fund_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One line of a worker's ledger.
 *
 * Entries are rows, not balances: a worker's position and an allocation's
 * utilization are always summed from them.
 */
@Value
@Builder(toBuilder = true)
public class LedgerEntry {
    UUID id;
    UUID organizationId;
    UUID workerId;
    UUID siteId;
    UUID createdBy;
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
    Instant paidAt;
    Instant createdAt;
    Instant updatedAt;
    Long sequenceNumber;

    /**
     * A credit that consumes funds from the allocation it references.
     */
    public boolean isCashMovingCredit() {
        return type == EntryType.CREDIT && category.isCashMoving();
    }

    public boolean isAdvance() {
        return type == EntryType.CREDIT && category == LedgerCategory.ADVANCE;
    }
}
