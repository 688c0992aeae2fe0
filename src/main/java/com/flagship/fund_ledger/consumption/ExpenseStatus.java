package com.flagship.fund_ledger.consumption;

/**
 * PENDING and APPROVED expenses both consume their allocation; only a
 * rejection releases the amount again.
 */
public enum ExpenseStatus {
    PENDING,
    APPROVED,
    REJECTED
}
