package com.flagship.fund_ledger.allocation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Input of {@link FundAllocationService#createAllocation}; the creator is the caller.
 */
@Value
@Builder
public class CreateAllocationCommand {
    UUID toUserId;
    BigDecimal amount;
    AllocationPurpose purpose;
    UUID siteId;
    String description;
    String referenceNumber;
    UUID sourceAllocationId;
}
