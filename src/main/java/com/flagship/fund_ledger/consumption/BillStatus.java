package com.flagship.fund_ledger.consumption;

/**
 * Status of a GST bill.
 *
 * Any bill that is not REJECTED consumes its allocation and the wallet of the
 * allocation's recipient. A bill without an allocation is charged to its
 * creator's wallet once it is CREDITED or PAID.
 */
public enum BillStatus {
    PENDING,
    CREDITED,
    PAID,
    REJECTED
}
