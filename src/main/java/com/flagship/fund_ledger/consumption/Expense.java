package com.flagship.fund_ledger.consumption;

import com.flagship.fund_ledger.common.exception.InvalidStateException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A site expense paid out of a disbursed fund allocation.
 */
@Value
@Builder(toBuilder = true)
public class Expense {
    UUID id;
    UUID organizationId;
    UUID siteId;
    UUID userId;
    UUID fundAllocationId;
    BigDecimal amount;
    ExpenseStatus status;
    String description;
    String vendorName;
    LocalDate expenseDate;
    UUID approvedBy;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Developer expenses are approved on creation, everyone else's wait for review.
     */
    public static Expense create(UUID organizationId, UUID siteId, UUID userId, UUID fundAllocationId,
                                 BigDecimal amount, String description, String vendorName, LocalDate expenseDate,
                                 boolean autoApprove) {
        Instant now = Instant.now();
        return Expense.builder()
            .id(UUID.randomUUID())
            .organizationId(organizationId)
            .siteId(siteId)
            .userId(userId)
            .fundAllocationId(fundAllocationId)
            .amount(amount)
            .status(autoApprove ? ExpenseStatus.APPROVED : ExpenseStatus.PENDING)
            .description(description)
            .vendorName(vendorName)
            .expenseDate(expenseDate != null ? expenseDate : LocalDate.now())
            .approvedBy(autoApprove ? userId : null)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Only a pending expense can be reviewed. Approving a rejected expense
     * would consume its allocation a second time without a funds check.
     *
     * @throws InvalidStateException if the expense has already been reviewed
     */
    public Expense review(ExpenseStatus target, UUID reviewerId) {
        if (status != ExpenseStatus.PENDING || target == ExpenseStatus.PENDING) {
            throw InvalidStateException.invalidTransition(id, status, target);
        }
        return toBuilder()
            .status(target)
            .approvedBy(target == ExpenseStatus.APPROVED ? reviewerId : null)
            .updatedAt(Instant.now())
            .build();
    }
}
