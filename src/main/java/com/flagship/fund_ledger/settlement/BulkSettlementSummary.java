package com.flagship.fund_ledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class BulkSettlementSummary {
    UUID allocationId;
    int workersRequested;
    int workersProcessed;
    BigDecimal totalGross;
    BigDecimal totalAdvances;
    BigDecimal totalNet;
    List<SettlementSummary> workers;
}
