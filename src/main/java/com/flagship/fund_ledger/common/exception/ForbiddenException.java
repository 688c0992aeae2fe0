package com.flagship.fund_ledger.common.exception;

import java.util.Map;

public class ForbiddenException extends FundLedgerException {

    public ForbiddenException(String reason) {
        super(ErrorCode.FORBIDDEN, reason, Map.of("reason", reason));
    }
}
