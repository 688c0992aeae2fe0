package com.flagship.fund_ledger.common.exception;

import java.util.Map;

public class EmptySelectionException extends FundLedgerException {

    public EmptySelectionException(String message, int requested) {
        super(ErrorCode.EMPTY_SELECTION, message, Map.of("requested", requested));
    }
}
