package com.flagship.fund_ledger.ledger;

public enum LedgerStatus {
    PENDING,
    PAID
}
