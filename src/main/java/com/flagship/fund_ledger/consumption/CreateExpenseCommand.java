package com.flagship.fund_ledger.consumption;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class CreateExpenseCommand {
    UUID siteId;
    UUID fundAllocationId;
    BigDecimal amount;
    String description;
    String vendorName;
    LocalDate expenseDate;
}
