package com.flagship.fund_ledger.common.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every domain failure raised by the engine.
 *
 * Carries an {@link ErrorCode} and a detail map so the API layer can explain
 * the failure (current balance, requested amount, current status) without a
 * second round-trip. Thrown inside a transaction, it rolls the transaction back.
 */
public abstract class FundLedgerException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, String> details;

    protected FundLedgerException(ErrorCode code, String message, Map<String, ?> details) {
        super(message);
        this.code = code;
        Map<String, String> copy = new LinkedHashMap<>();
        if (details != null) {
            details.forEach((key, value) -> copy.put(key, value == null ? null : value.toString()));
        }
        this.details = Collections.unmodifiableMap(copy);
    }

    public ErrorCode getCode() {
        return code;
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
