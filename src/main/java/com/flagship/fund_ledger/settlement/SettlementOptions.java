package com.flagship.fund_ledger.settlement;

import com.flagship.fund_ledger.ledger.PaymentMode;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Scope and payment details of a settlement. Site and date range narrow the
 * pending salary that gets paid; unpaid advances are always deducted in full.
 */
@Value
@Builder
public class SettlementOptions {
    UUID siteId;
    LocalDate startDate;
    LocalDate endDate;
    PaymentMode paymentMode;
    String referenceNumber;
    String description;

    public static SettlementOptions none() {
        return SettlementOptions.builder().build();
    }
}
