package com.flagship.fund_ledger.allocation.event;

import com.flagship.fund_ledger.allocation.FundAllocation;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class FundAllocationCreatedEvent implements FundAllocationEvent {
    UUID eventId;
    UUID allocationId;
    UUID organizationId;
    UUID fromUserId;
    UUID toUserId;
    UUID siteId;
    UUID sourceAllocationId;
    BigDecimal amount;
    String purpose;
    String status;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FundAllocationCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static FundAllocationCreatedEvent from(FundAllocation allocation) {
        return new FundAllocationCreatedEvent(
            UUID.randomUUID(),
            allocation.getId(),
            allocation.getOrganizationId(),
            allocation.getFromUserId(),
            allocation.getToUserId(),
            allocation.getSiteId(),
            allocation.getSourceAllocationId(),
            allocation.getAmount(),
            allocation.getPurpose().name(),
            allocation.getStatus().name(),
            Instant.now()
        );
    }
}
