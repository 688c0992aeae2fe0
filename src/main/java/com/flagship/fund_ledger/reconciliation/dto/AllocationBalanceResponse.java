package com.flagship.fund_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.allocation.AllocationStatus;
import com.flagship.fund_ledger.reconciliation.AllocationBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class AllocationBalanceResponse {

    @JsonProperty("allocation_id")
    UUID allocationId;

    @JsonProperty("status")
    AllocationStatus status;

    @JsonProperty("allocated")
    BigDecimal allocated;

    @JsonProperty("utilized")
    BigDecimal utilized;

    @JsonProperty("remaining")
    BigDecimal remaining;

    @JsonProperty("expenses")
    BigDecimal expenses;

    @JsonProperty("bills")
    BigDecimal bills;

    @JsonProperty("ledger_net")
    BigDecimal ledgerNet;

    @JsonProperty("sub_allocations")
    BigDecimal subAllocations;

    public static AllocationBalanceResponse from(AllocationBalance balance) {
        return AllocationBalanceResponse.builder()
            .allocationId(balance.getAllocationId())
            .status(balance.getStatus())
            .allocated(balance.getAllocated())
            .utilized(balance.getUtilized())
            .remaining(balance.getRemaining())
            .expenses(balance.getExpenses())
            .bills(balance.getBills())
            .ledgerNet(balance.getLedgerNet())
            .subAllocations(balance.getSubAllocations())
            .build();
    }
}
