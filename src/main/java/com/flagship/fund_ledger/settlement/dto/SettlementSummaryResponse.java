package com.flagship.fund_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.settlement.SettlementSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class SettlementSummaryResponse {

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("fund_allocation_id")
    UUID fundAllocationId;

    @JsonProperty("gross")
    BigDecimal gross;

    @JsonProperty("advances_deducted")
    BigDecimal advancesDeducted;

    @JsonProperty("net_payable")
    BigDecimal netPayable;

    @JsonProperty("net_paid")
    BigDecimal netPaid;

    @JsonProperty("pending_entries_settled")
    int pendingEntriesSettled;

    @JsonProperty("advances_settled")
    int advancesSettled;

    @JsonProperty("payment_entry_id")
    UUID paymentEntryId;

    public static SettlementSummaryResponse from(SettlementSummary summary) {
        return SettlementSummaryResponse.builder()
            .workerId(summary.getWorkerId())
            .fundAllocationId(summary.getAllocationId())
            .gross(summary.getGross())
            .advancesDeducted(summary.getAdvancesDeducted())
            .netPayable(summary.getNetPayable())
            .netPaid(summary.getNetPaid())
            .pendingEntriesSettled(summary.getPendingEntriesSettled())
            .advancesSettled(summary.getAdvancesSettled())
            .paymentEntryId(summary.getPaymentEntryId())
            .build();
    }
}
