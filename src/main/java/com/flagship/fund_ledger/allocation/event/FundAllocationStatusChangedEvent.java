package com.flagship.fund_ledger.allocation.event;

import com.flagship.fund_ledger.allocation.AllocationStatus;
import com.flagship.fund_ledger.allocation.FundAllocation;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published on every status change, carrying both sides of the transition.
 */
@Value
public class FundAllocationStatusChangedEvent implements FundAllocationEvent {
    UUID eventId;
    UUID allocationId;
    UUID changedBy;
    String previousStatus;
    String newStatus;
    BigDecimal amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FundAllocationStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static FundAllocationStatusChangedEvent from(FundAllocation allocation, AllocationStatus previous,
                                                        UUID changedBy) {
        return new FundAllocationStatusChangedEvent(
            UUID.randomUUID(),
            allocation.getId(),
            changedBy,
            previous.name(),
            allocation.getStatus().name(),
            allocation.getAmount(),
            Instant.now()
        );
    }
}
