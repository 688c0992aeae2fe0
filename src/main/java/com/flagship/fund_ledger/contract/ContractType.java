package com.flagship.fund_ledger.contract;

public enum ContractType {
    FIXED,
    MILESTONE,
    DAILY
}
