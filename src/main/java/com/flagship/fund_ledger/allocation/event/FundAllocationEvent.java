package com.flagship.fund_ledger.allocation.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of fund allocation events. The event id lets consumers
 * deduplicate; the allocation id is the Kafka key.
 */
public interface FundAllocationEvent {

    UUID getEventId();

    UUID getAllocationId();

    Instant getOccurredAt();

    String getEventType();
}
