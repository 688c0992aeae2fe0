package com.flagship.fund_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.ledger.EntryType;
import com.flagship.fund_ledger.ledger.LedgerCategory;
import com.flagship.fund_ledger.ledger.WorkerBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class WorkerBalanceResponse {

    @JsonProperty("worker_id")
    UUID workerId;

    @JsonProperty("worker_name")
    String workerName;

    @JsonProperty("worker_email")
    String workerEmail;

    @JsonProperty("total_credits")
    BigDecimal totalCredits;

    @JsonProperty("total_debits")
    BigDecimal totalDebits;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("category_summary")
    List<CategoryLine> categorySummary;

    public static WorkerBalanceResponse from(WorkerBalance balance) {
        return WorkerBalanceResponse.builder()
            .workerId(balance.getWorkerId())
            .workerName(balance.getWorkerName())
            .workerEmail(balance.getWorkerEmail())
            .totalCredits(balance.getTotalCredits())
            .totalDebits(balance.getTotalDebits())
            .balance(balance.getBalance())
            .categorySummary(balance.getCategorySummary().stream()
                .map(total -> new CategoryLine(total.getType(), total.getCategory(), total.getTotal(), total.getEntries()))
                .toList())
            .build();
    }

    @Value
    public static class CategoryLine {
        @JsonProperty("type")
        EntryType type;

        @JsonProperty("category")
        LedgerCategory category;

        @JsonProperty("total")
        BigDecimal total;

        @JsonProperty("count")
        long count;
    }
}
