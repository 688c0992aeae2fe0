package com.flagship.fund_ledger.common.exception;

import java.util.Map;
import java.util.UUID;

public class NotFoundException extends FundLedgerException {

    public NotFoundException(String resource, UUID id) {
        super(ErrorCode.NOT_FOUND, resource + " not found: " + id,
            Map.of("resource", resource, "id", String.valueOf(id)));
    }
}
