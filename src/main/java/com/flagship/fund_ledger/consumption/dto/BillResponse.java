package com.flagship.fund_ledger.consumption.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.consumption.Bill;
import com.flagship.fund_ledger.consumption.BillStatus;
import com.flagship.fund_ledger.consumption.BillType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class BillResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("site_id")
    UUID siteId;

    @JsonProperty("created_by")
    UUID createdBy;

    @JsonProperty("fund_allocation_id")
    UUID fundAllocationId;

    @JsonProperty("vendor_name")
    String vendorName;

    @JsonProperty("vendor_gst_number")
    String vendorGstNumber;

    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("bill_date")
    LocalDate billDate;

    @JsonProperty("base_amount")
    BigDecimal baseAmount;

    @JsonProperty("gst_amount")
    BigDecimal gstAmount;

    @JsonProperty("gst_rate")
    BigDecimal gstRate;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("bill_type")
    BillType billType;

    @JsonProperty("status")
    BillStatus status;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BillResponse from(Bill bill) {
        return BillResponse.builder()
            .id(bill.getId())
            .siteId(bill.getSiteId())
            .createdBy(bill.getCreatedBy())
            .fundAllocationId(bill.getFundAllocationId())
            .vendorName(bill.getVendorName())
            .vendorGstNumber(bill.getVendorGstNumber())
            .invoiceNumber(bill.getInvoiceNumber())
            .billDate(bill.getBillDate())
            .baseAmount(bill.getBaseAmount())
            .gstAmount(bill.getGstAmount())
            .gstRate(bill.getGstRate())
            .totalAmount(bill.getTotalAmount())
            .billType(bill.getBillType())
            .status(bill.getStatus())
            .description(bill.getDescription())
            .createdAt(bill.getCreatedAt())
            .build();
    }
}
