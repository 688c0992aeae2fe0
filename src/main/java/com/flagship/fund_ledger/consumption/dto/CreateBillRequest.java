package com.flagship.fund_ledger.consumption.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.consumption.BillType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class CreateBillRequest {

    @JsonProperty("site_id")
    UUID siteId;

    @JsonProperty("fund_allocation_id")
    UUID fundAllocationId;

    @NotBlank(message = "Vendor name is required")
    @Size(max = 200)
    @JsonProperty("vendor_name")
    String vendorName;

    @Size(max = 30)
    @JsonProperty("vendor_gst_number")
    String vendorGstNumber;

    @Size(max = 100)
    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("bill_date")
    LocalDate billDate;

    @NotNull(message = "Base amount is required")
    @DecimalMin(value = "0.01", message = "Base amount must be greater than 0")
    @Digits(integer = 17, fraction = 2)
    @JsonProperty("base_amount")
    BigDecimal baseAmount;

    @DecimalMin(value = "0.00", message = "GST amount must not be negative")
    @Digits(integer = 17, fraction = 2)
    @JsonProperty("gst_amount")
    BigDecimal gstAmount;

    @DecimalMin("0.00")
    @DecimalMax("100.00")
    @JsonProperty("gst_rate")
    BigDecimal gstRate;

    @JsonProperty("bill_type")
    BillType billType;

    @Size(max = 1000)
    @JsonProperty("description")
    String description;
}
