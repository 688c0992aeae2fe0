package com.flagship.fund_ledger.common.exception;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public class InsufficientFundsException extends FundLedgerException {

    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientFundsException(UUID allocationId, BigDecimal available, BigDecimal requested) {
        super(ErrorCode.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds. Available: %s, Requested: %s", available, requested),
            details(allocationId, available, requested));
        this.available = available;
        this.requested = requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    private static Map<String, Object> details(UUID allocationId, BigDecimal available, BigDecimal requested) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("allocationId", allocationId);
        details.put("available", available);
        details.put("requested", requested);
        return details;
    }
}
