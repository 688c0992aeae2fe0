package com.flagship.fund_ledger.contract;

import com.flagship.fund_ledger.ledger.PaymentMode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Payment against one installment. {@code fundAllocationId} overrides the
 * contract's own allocation when present.
 */
@Value
@Builder
public class ContractPaymentCommand {
    int installmentNumber;
    BigDecimal amount;
    UUID fundAllocationId;
    PaymentMode paymentMode;
    String referenceNumber;
    String notes;
}
