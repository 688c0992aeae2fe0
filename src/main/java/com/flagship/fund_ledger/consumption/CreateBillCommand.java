package com.flagship.fund_ledger.consumption;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class CreateBillCommand {
    UUID siteId;
    UUID fundAllocationId;
    String vendorName;
    String vendorGstNumber;
    String invoiceNumber;
    LocalDate billDate;
    BigDecimal baseAmount;
    BigDecimal gstAmount;
    BigDecimal gstRate;
    BillType billType;
    String description;
}
