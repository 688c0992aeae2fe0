package com.flagship.fund_ledger.consumption;

import com.flagship.fund_ledger.common.exception.InvalidStateException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A vendor bill with GST. The total is always base plus GST and is what the
 * bill consumes.
 */
@Value
@Builder(toBuilder = true)
public class Bill {
    public static final BigDecimal DEFAULT_GST_RATE = new BigDecimal("18.00");

    UUID id;
    UUID organizationId;
    UUID siteId;
    UUID createdBy;
    UUID fundAllocationId;
    String vendorName;
    String vendorGstNumber;
    String invoiceNumber;
    LocalDate billDate;
    BigDecimal baseAmount;
    BigDecimal gstAmount;
    BigDecimal gstRate;
    BigDecimal totalAmount;
    BillType billType;
    BillStatus status;
    String description;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Moves the bill to CREDITED, PAID or REJECTED.
     *
     * @throws InvalidStateException if the move is not allowed
     */
    public Bill transitionTo(BillStatus target) {
        if (!canTransitionTo(target)) {
            throw InvalidStateException.invalidTransition(id, status, target);
        }
        return toBuilder()
            .status(target)
            .updatedAt(Instant.now())
            .build();
    }

    public boolean canTransitionTo(BillStatus target) {
        return switch (status) {
            case PENDING -> target == BillStatus.CREDITED || target == BillStatus.PAID || target == BillStatus.REJECTED;
            case CREDITED -> target == BillStatus.PAID || target == BillStatus.REJECTED;
            case PAID, REJECTED -> false;
        };
    }
}
