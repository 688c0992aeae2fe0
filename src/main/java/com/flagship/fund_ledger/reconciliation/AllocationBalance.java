package com.flagship.fund_ledger.reconciliation;

import com.flagship.fund_ledger.allocation.AllocationStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class AllocationBalance {
    UUID allocationId;
    AllocationStatus status;
    BigDecimal allocated;
    BigDecimal expenses;
    BigDecimal bills;
    BigDecimal ledgerNet;
    BigDecimal subAllocations;
    BigDecimal utilized;
    BigDecimal remaining;
}
