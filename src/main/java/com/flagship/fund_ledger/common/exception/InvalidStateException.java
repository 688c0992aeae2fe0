package com.flagship.fund_ledger.common.exception;

import java.util.Map;

/**
 * Raised when a record is not in a state that permits the requested operation:
 * an allocation that is not disbursed, an invalid status transition, an
 * inactive contract, or an allocation still referenced by consuming records.
 */
public class InvalidStateException extends FundLedgerException {

    public InvalidStateException(ErrorCode code, String message, Map<String, ?> details) {
        super(code, message, details);
    }

    public static InvalidStateException notDisbursed(Object allocationId, Object currentStatus) {
        return new InvalidStateException(ErrorCode.ALLOCATION_NOT_DISBURSED,
            String.format("Fund allocation must be disbursed before use (current status: %s)", currentStatus),
            Map.of("allocationId", allocationId, "status", currentStatus));
    }

    public static InvalidStateException invalidTransition(Object id, Object from, Object to) {
        return new InvalidStateException(ErrorCode.INVALID_TRANSITION,
            String.format("Cannot move %s from %s to %s", id, from, to),
            Map.of("id", id, "from", from, "to", to));
    }
}
