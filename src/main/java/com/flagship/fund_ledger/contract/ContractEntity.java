package com.flagship.fund_ledger.contract;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderBy;
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
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for contracts. Installments are an element collection, so they
 * are only ever written together with their contract.
 */
@Entity
@Table(name = "contracts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ContractEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Column(name = "worker_id", nullable = false, updatable = false)
    private UUID workerId;

    @Column(name = "site_id", nullable = false, updatable = false)
    private UUID siteId;

    @Column(name = "created_by", nullable = false, updatable = false)
    private UUID createdBy;

    @Column(name = "fund_allocation_id", updatable = false)
    private UUID fundAllocationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "contract_type", nullable = false, updatable = false)
    private ContractType contractType;

    @Column(nullable = false, updatable = false)
    private String title;

    @Column(name = "description", updatable = false)
    private String description;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal totalAmount;

    @Column(name = "total_paid", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalPaid;

    @Column(name = "number_of_installments", nullable = false, updatable = false)
    private int numberOfInstallments;

    @Column(name = "daily_rate", precision = 19, scale = 2, updatable = false)
    private BigDecimal dailyRate;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date", updatable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ContractStatus status;

    @ElementCollection
    @CollectionTable(name = "contract_installments", joinColumns = @JoinColumn(name = "contract_id"))
    @OrderBy("installmentNumber ASC")
    private List<InstallmentEmbeddable> installments = new ArrayList<>();

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

    static ContractEntity fromDomain(Contract contract) {
        return new ContractEntity(
            contract.getId(),
            contract.getOrganizationId(),
            contract.getWorkerId(),
            contract.getSiteId(),
            contract.getCreatedBy(),
            contract.getFundAllocationId(),
            contract.getContractType(),
            contract.getTitle(),
            contract.getDescription(),
            contract.getTotalAmount(),
            contract.getTotalPaid(),
            contract.getNumberOfInstallments(),
            contract.getDailyRate(),
            contract.getStartDate(),
            contract.getEndDate(),
            contract.getStatus(),
            toEmbeddables(contract.getInstallments()),
            contract.getCreatedAt(),
            contract.getUpdatedAt()
        );
    }

    public Contract toDomain() {
        return Contract.builder()
            .id(id)
            .organizationId(organizationId)
            .workerId(workerId)
            .siteId(siteId)
            .createdBy(createdBy)
            .fundAllocationId(fundAllocationId)
            .contractType(contractType)
            .title(title)
            .description(description)
            .totalAmount(totalAmount)
            .totalPaid(totalPaid)
            .numberOfInstallments(numberOfInstallments)
            .dailyRate(dailyRate)
            .startDate(startDate)
            .endDate(endDate)
            .status(status)
            .installments(installments.stream().map(InstallmentEmbeddable::toDomain).toList())
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    void updateFromDomain(Contract contract) {
        this.status = contract.getStatus();
        this.totalPaid = contract.getTotalPaid();
        this.installments.clear();
        this.installments.addAll(toEmbeddables(contract.getInstallments()));
    }

    private static List<InstallmentEmbeddable> toEmbeddables(List<ContractInstallment> installments) {
        List<InstallmentEmbeddable> rows = new ArrayList<>(installments.size());
        for (ContractInstallment installment : installments) {
            rows.add(InstallmentEmbeddable.fromDomain(installment));
        }
        return rows;
    }
}
