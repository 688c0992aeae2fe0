package com.flagship.fund_ledger.ledger;

public enum LedgerCategory {
    SALARY,
    PENDING_SALARY,
    ADVANCE,
    DEDUCTION,
    BONUS,
    CONTRACT_PAYMENT,
    REIMBURSEMENT,
    OTHER;

    /**
     * Whether an entry of this category moves money out of (credit) or back
     * into (debit) a fund allocation. Pending salary is an accrual and a
     * deduction offsets an advance that already moved cash, so neither counts.
     */
    public boolean isCashMoving() {
        return this != PENDING_SALARY && this != DEDUCTION;
    }
}
