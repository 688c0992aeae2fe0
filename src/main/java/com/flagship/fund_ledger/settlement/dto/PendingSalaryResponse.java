package com.flagship.fund_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.ledger.dto.LedgerEntryResponse;
import com.flagship.fund_ledger.settlement.PendingSalary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class PendingSalaryResponse {

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("pending_entries")
    List<LedgerEntryResponse> pendingEntries;

    @JsonProperty("total_pending")
    BigDecimal totalPending;

    @JsonProperty("unpaid_advances")
    List<LedgerEntryResponse> unpaidAdvances;

    @JsonProperty("total_advances")
    BigDecimal totalAdvances;

    @JsonProperty("net_payable")
    BigDecimal netPayable;

    public static PendingSalaryResponse from(PendingSalary pending) {
        return PendingSalaryResponse.builder()
            .workerId(pending.getWorkerId())
            .pendingEntries(pending.getPendingEntries().stream().map(LedgerEntryResponse::from).toList())
            .totalPending(pending.getTotalPending())
            .unpaidAdvances(pending.getUnpaidAdvances().stream().map(LedgerEntryResponse::from).toList())
            .totalAdvances(pending.getTotalAdvances())
            .netPayable(pending.getNetPayable())
            .build();
    }
}
