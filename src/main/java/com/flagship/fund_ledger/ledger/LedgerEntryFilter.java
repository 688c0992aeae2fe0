package com.flagship.fund_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

/**
 * Criteria for listing ledger entries. {@code visibleWorkerIds} is applied
 * when set and restricts the result to those workers.
 */
@Value
@Builder(toBuilder = true)
public class LedgerEntryFilter {
    UUID organizationId;
    Set<UUID> visibleWorkerIds;
    UUID workerId;
    UUID siteId;
    EntryType type;
    LedgerCategory category;
    LedgerStatus status;
    LocalDate startDate;
    LocalDate endDate;
}
