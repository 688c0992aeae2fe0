package com.flagship.fund_ledger.ledger;

/**
 * Direction of a worker ledger entry. A CREDIT is money owed or paid to the
 * worker, a DEBIT is money taken back from them.
 */
public enum EntryType {
    CREDIT,
    DEBIT
}
