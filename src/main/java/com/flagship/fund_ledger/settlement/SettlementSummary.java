package com.flagship.fund_ledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of settling one worker. {@code paymentEntryId} is null when the
 * advances consumed the whole pending salary.
 */
@Value
@Builder
public class SettlementSummary {
    UUID workerId;
    UUID allocationId;
    BigDecimal gross;
    BigDecimal advancesDeducted;
    BigDecimal netPayable;
    BigDecimal netPaid;
    int pendingEntriesSettled;
    int advancesSettled;
    UUID paymentEntryId;
}
