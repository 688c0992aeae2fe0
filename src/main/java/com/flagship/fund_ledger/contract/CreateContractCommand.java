package com.flagship.fund_ledger.contract;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class CreateContractCommand {
    UUID workerId;
    UUID siteId;
    UUID fundAllocationId;
    ContractType contractType;
    String title;
    String description;
    BigDecimal totalAmount;
    Integer numberOfInstallments;
    BigDecimal dailyRate;
    LocalDate startDate;
    LocalDate endDate;
}
