package com.flagship.fund_ledger.allocation;

/**
 * Lifecycle of a fund allocation.
 *
 * Status fields are not "just columns": only DISBURSED allocations can be
 * consumed, and DISBURSED and REJECTED accept no further transitions.
 */
public enum AllocationStatus {
    /**
     * Created by an engineer or supervisor, waiting for approval or disbursement.
     */
    PENDING,

    /**
     * Approved by a developer but funds not yet handed over.
     */
    APPROVED,

    /**
     * Funds handed over. Terminal; the allocation becomes spendable.
     */
    DISBURSED,

    /**
     * Refused. Terminal; contributes nothing to any balance.
     */
    REJECTED;

    public boolean isTerminal() {
        return this == DISBURSED || this == REJECTED;
    }
}
