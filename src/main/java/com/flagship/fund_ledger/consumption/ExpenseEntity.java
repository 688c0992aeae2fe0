package com.flagship.fund_ledger.consumption;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "expenses")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExpenseEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Column(name = "site_id", nullable = false, updatable = false)
    private UUID siteId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "fund_allocation_id", nullable = false, updatable = false)
    private UUID fundAllocationId;

    @Column(nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExpenseStatus status;

    @Column(name = "description")
    private String description;

    @Column(name = "vendor_name")
    private String vendorName;

    @Column(name = "expense_date", nullable = false, updatable = false)
    private LocalDate expenseDate;

    @Column(name = "approved_by")
    private UUID approvedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static ExpenseEntity fromDomain(Expense expense) {
        return new ExpenseEntity(
            expense.getId(),
            expense.getOrganizationId(),
            expense.getSiteId(),
            expense.getUserId(),
            expense.getFundAllocationId(),
            expense.getAmount(),
            expense.getStatus(),
            expense.getDescription(),
            expense.getVendorName(),
            expense.getExpenseDate(),
            expense.getApprovedBy(),
            expense.getCreatedAt(),
            expense.getUpdatedAt()
        );
    }

    public Expense toDomain() {
        return Expense.builder()
            .id(id)
            .organizationId(organizationId)
            .siteId(siteId)
            .userId(userId)
            .fundAllocationId(fundAllocationId)
            .amount(amount)
            .status(status)
            .description(description)
            .vendorName(vendorName)
            .expenseDate(expenseDate)
            .approvedBy(approvedBy)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Review is the only change an expense accepts once saved.
     */
    void updateFromDomain(Expense expense) {
        this.status = expense.getStatus();
        this.approvedBy = expense.getApprovedBy();
    }
}
