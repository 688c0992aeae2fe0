package com.flagship.fund_ledger.reconciliation;

/**
 * Machine-readable outcome of an availability check.
 */
public enum AvailabilityMessage {
    OK,
    ALLOCATION_NOT_FOUND,
    ALLOCATION_NOT_DISBURSED,
    INVALID_AMOUNT,
    INSUFFICIENT_BALANCE
}
