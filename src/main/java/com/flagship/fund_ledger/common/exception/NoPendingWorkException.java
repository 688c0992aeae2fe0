package com.flagship.fund_ledger.common.exception;

import java.util.Map;
import java.util.UUID;

public class NoPendingWorkException extends FundLedgerException {

    public NoPendingWorkException(UUID workerId) {
        super(ErrorCode.NO_PENDING_WORK, "No pending salary entries to pay for worker " + workerId,
            Map.of("workerId", workerId));
    }
}
