package com.flagship.fund_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.settlement.BulkSettlementSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class BulkSettlementSummaryResponse {

    @JsonProperty("fund_allocation_id")
    UUID fundAllocationId;

    @JsonProperty("workers_requested")
    int workersRequested;

    @JsonProperty("workers_processed")
    int workersProcessed;

    @JsonProperty("total_gross")
    BigDecimal totalGross;

    @JsonProperty("total_advances")
    BigDecimal totalAdvances;

    @JsonProperty("total_net")
    BigDecimal totalNet;

    @JsonProperty("workers")
    List<SettlementSummaryResponse> workers;

    public static BulkSettlementSummaryResponse from(BulkSettlementSummary summary) {
        return BulkSettlementSummaryResponse.builder()
            .fundAllocationId(summary.getAllocationId())
            .workersRequested(summary.getWorkersRequested())
            .workersProcessed(summary.getWorkersProcessed())
            .totalGross(summary.getTotalGross())
            .totalAdvances(summary.getTotalAdvances())
            .totalNet(summary.getTotalNet())
            .workers(summary.getWorkers().stream().map(SettlementSummaryResponse::from).toList())
            .build();
    }
}
