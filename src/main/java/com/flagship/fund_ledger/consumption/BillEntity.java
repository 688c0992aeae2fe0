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
@Table(name = "bills")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BillEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Column(name = "site_id", updatable = false)
    private UUID siteId;

    @Column(name = "created_by", nullable = false, updatable = false)
    private UUID createdBy;

    @Column(name = "fund_allocation_id", updatable = false)
    private UUID fundAllocationId;

    @Column(name = "vendor_name", nullable = false, updatable = false)
    private String vendorName;

    @Column(name = "vendor_gst_number", updatable = false)
    private String vendorGstNumber;

    @Column(name = "invoice_number", updatable = false)
    private String invoiceNumber;

    @Column(name = "bill_date", nullable = false, updatable = false)
    private LocalDate billDate;

    @Column(name = "base_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal baseAmount;

    @Column(name = "gst_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal gstAmount;

    @Column(name = "gst_rate", nullable = false, precision = 5, scale = 2, updatable = false)
    private BigDecimal gstRate;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "bill_type", nullable = false, updatable = false)
    private BillType billType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BillStatus status;

    @Column(name = "description", updatable = false)
    private String description;

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

    static BillEntity fromDomain(Bill bill) {
        return new BillEntity(
            bill.getId(),
            bill.getOrganizationId(),
            bill.getSiteId(),
            bill.getCreatedBy(),
            bill.getFundAllocationId(),
            bill.getVendorName(),
            bill.getVendorGstNumber(),
            bill.getInvoiceNumber(),
            bill.getBillDate(),
            bill.getBaseAmount(),
            bill.getGstAmount(),
            bill.getGstRate(),
            bill.getTotalAmount(),
            bill.getBillType(),
            bill.getStatus(),
            bill.getDescription(),
            bill.getCreatedAt(),
            bill.getUpdatedAt()
        );
    }

    public Bill toDomain() {
        return Bill.builder()
            .id(id)
            .organizationId(organizationId)
            .siteId(siteId)
            .createdBy(createdBy)
            .fundAllocationId(fundAllocationId)
            .vendorName(vendorName)
            .vendorGstNumber(vendorGstNumber)
            .invoiceNumber(invoiceNumber)
            .billDate(billDate)
            .baseAmount(baseAmount)
            .gstAmount(gstAmount)
            .gstRate(gstRate)
            .totalAmount(totalAmount)
            .billType(billType)
            .status(status)
            .description(description)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    void updateFromDomain(Bill bill) {
        this.status = bill.getStatus();
    }
}
