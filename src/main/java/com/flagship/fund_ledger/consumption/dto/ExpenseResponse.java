package com.flagship.fund_ledger.consumption.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.consumption.Expense;
import com.flagship.fund_ledger.consumption.ExpenseStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class ExpenseResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("site_id")
    UUID siteId;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("fund_allocation_id")
    UUID fundAllocationId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("status")
    ExpenseStatus status;

    @JsonProperty("description")
    String description;

    @JsonProperty("vendor_name")
    String vendorName;

    @JsonProperty("expense_date")
    LocalDate expenseDate;

    @JsonProperty("approved_by")
    UUID approvedBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ExpenseResponse from(Expense expense) {
        return ExpenseResponse.builder()
            .id(expense.getId())
            .siteId(expense.getSiteId())
            .userId(expense.getUserId())
            .fundAllocationId(expense.getFundAllocationId())
            .amount(expense.getAmount())
            .status(expense.getStatus())
            .description(expense.getDescription())
            .vendorName(expense.getVendorName())
            .expenseDate(expense.getExpenseDate())
            .approvedBy(expense.getApprovedBy())
            .createdAt(expense.getCreatedAt())
            .build();
    }
}
