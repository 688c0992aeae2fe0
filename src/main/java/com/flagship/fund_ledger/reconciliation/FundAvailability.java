package com.flagship.fund_ledger.reconciliation;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Result of {@link ReconciliationService#validateAvailability}. Anything other
 * than {@link AvailabilityMessage#OK} means not available.
 */
@Value
public class FundAvailability {
    UUID allocationId;
    boolean available;
    BigDecimal balance;
    BigDecimal requested;
    AvailabilityMessage message;

    static FundAvailability of(UUID allocationId, BigDecimal balance, BigDecimal requested,
                               AvailabilityMessage message) {
        return new FundAvailability(allocationId, message == AvailabilityMessage.OK, balance, requested, message);
    }
}
