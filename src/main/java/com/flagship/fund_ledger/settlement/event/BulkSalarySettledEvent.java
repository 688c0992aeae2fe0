package com.flagship.fund_ledger.settlement.event;

import com.flagship.fund_ledger.settlement.BulkSettlementSummary;
import com.flagship.fund_ledger.settlement.SettlementSummary;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published once per bulk settlement, listing every worker that was paid.
 */
@Value
public class BulkSalarySettledEvent {
    UUID eventId;
    UUID allocationId;
    UUID settledBy;
    List<UUID> workerIds;
    BigDecimal totalGross;
    BigDecimal totalAdvances;
    BigDecimal totalNet;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BulkSalarySettled";

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static BulkSalarySettledEvent from(BulkSettlementSummary summary, UUID settledBy) {
        return new BulkSalarySettledEvent(
            UUID.randomUUID(),
            summary.getAllocationId(),
            settledBy,
            summary.getWorkers().stream().map(SettlementSummary::getWorkerId).toList(),
            summary.getTotalGross(),
            summary.getTotalAdvances(),
            summary.getTotalNet(),
            Instant.now()
        );
    }
}
