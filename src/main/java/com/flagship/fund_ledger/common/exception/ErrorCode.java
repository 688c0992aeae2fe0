package com.flagship.fund_ledger.common.exception;

/**
 * Machine-readable error codes returned to callers.
 */
public enum ErrorCode {
    NOT_FOUND,
    FORBIDDEN,
    INVALID_STATE,
    INVALID_TRANSITION,
    ALLOCATION_NOT_DISBURSED,
    ALLOCATION_IN_USE,
    CONTRACT_NOT_ACTIVE,
    INSUFFICIENT_FUNDS,
    NO_PENDING_WORK,
    EMPTY_SELECTION
}
