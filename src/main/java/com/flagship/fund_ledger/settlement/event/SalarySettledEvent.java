package com.flagship.fund_ledger.settlement.event;

import com.flagship.fund_ledger.settlement.SettlementSummary;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when one worker's pending salary has been paid.
 */
@Value
public class SalarySettledEvent {
    UUID eventId;
    UUID workerId;
    UUID allocationId;
    UUID settledBy;
    BigDecimal gross;
    BigDecimal advancesDeducted;
    BigDecimal netPaid;
    int pendingEntriesSettled;
    int advancesSettled;
    UUID paymentEntryId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SalarySettled";

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SalarySettledEvent from(SettlementSummary summary, UUID settledBy) {
        return new SalarySettledEvent(
            UUID.randomUUID(),
            summary.getWorkerId(),
            summary.getAllocationId(),
            settledBy,
            summary.getGross(),
            summary.getAdvancesDeducted(),
            summary.getNetPaid(),
            summary.getPendingEntriesSettled(),
            summary.getAdvancesSettled(),
            summary.getPaymentEntryId(),
            Instant.now()
        );
    }
}
