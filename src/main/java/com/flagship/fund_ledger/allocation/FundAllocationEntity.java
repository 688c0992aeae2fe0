package com.flagship.fund_ledger.allocation;

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

/**
 * JPA entity for fund allocation persistence.
 *
 * Key design principles:
 * - No setters: status and terms change only through {@link #updateFromDomain}
 * - Parties, organization and source allocation are updatable = false
 * - fromDomain() is the only way to create instances
 */
@Entity
@Table(name = "fund_allocations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FundAllocationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Column(name = "from_user_id", nullable = false, updatable = false)
    private UUID fromUserId;

    @Column(name = "to_user_id", nullable = false, updatable = false)
    private UUID toUserId;

    @Column(name = "site_id", updatable = false)
    private UUID siteId;

    @Column(name = "source_allocation_id", updatable = false)
    private UUID sourceAllocationId;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AllocationPurpose purpose;

    @Column(name = "description")
    private String description;

    @Column(name = "reference_number", updatable = false)
    private String referenceNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AllocationStatus status;

    @Column(name = "allocation_date", nullable = false, updatable = false)
    private LocalDate allocationDate;

    @Column(name = "disbursed_at")
    private Instant disbursedAt;

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

    static FundAllocationEntity fromDomain(FundAllocation allocation) {
        return new FundAllocationEntity(
            allocation.getId(),
            allocation.getOrganizationId(),
            allocation.getFromUserId(),
            allocation.getToUserId(),
            allocation.getSiteId(),
            allocation.getSourceAllocationId(),
            allocation.getAmount(),
            allocation.getPurpose(),
            allocation.getDescription(),
            allocation.getReferenceNumber(),
            allocation.getStatus(),
            allocation.getAllocationDate(),
            allocation.getDisbursedAt(),
            allocation.getCreatedAt(),
            allocation.getUpdatedAt()
        );
    }

    public FundAllocation toDomain() {
        return FundAllocation.builder()
            .id(id)
            .organizationId(organizationId)
            .fromUserId(fromUserId)
            .toUserId(toUserId)
            .siteId(siteId)
            .sourceAllocationId(sourceAllocationId)
            .amount(amount)
            .purpose(purpose)
            .description(description)
            .referenceNumber(referenceNumber)
            .status(status)
            .allocationDate(allocationDate)
            .disbursedAt(disbursedAt)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the mutable state of the domain object onto this entity.
     * Parties and organization never change after creation.
     */
    void updateFromDomain(FundAllocation allocation) {
        this.amount = allocation.getAmount();
        this.purpose = allocation.getPurpose();
        this.description = allocation.getDescription();
        this.status = allocation.getStatus();
        this.disbursedAt = allocation.getDisbursedAt();
    }
}
