package com.flagship.fund_ledger.contract;

/**
 * DRAFT contracts can be edited but not paid; ACTIVE contracts accept
 * installment payments; a contract COMPLETES once its total is paid.
 */
public enum ContractStatus {
    DRAFT,
    ACTIVE,
    COMPLETED
}
