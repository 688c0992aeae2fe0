package com.flagship.fund_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * A worker's ledger position: every credit and debit regardless of category.
 */
@Value
@Builder
public class WorkerBalance {
    UUID workerId;
    String workerName;
    String workerEmail;
    BigDecimal totalCredits;
    BigDecimal totalDebits;
    BigDecimal balance;
    List<WorkerLedgerRepository.CategoryTotal> categorySummary;
}
