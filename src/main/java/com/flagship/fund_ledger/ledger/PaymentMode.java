package com.flagship.fund_ledger.ledger;

public enum PaymentMode {
    CASH,
    BANK_TRANSFER,
    CHEQUE,
    UPI,
    OTHER
}
