package com.flagship.fund_ledger.contract;

public enum InstallmentStatus {
    PENDING,
    PARTIAL,
    PAID
}
