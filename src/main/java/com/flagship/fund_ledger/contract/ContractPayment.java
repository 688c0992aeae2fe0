package com.flagship.fund_ledger.contract;

import com.flagship.fund_ledger.ledger.LedgerEntry;
import lombok.Value;

@Value
public class ContractPayment {
    Contract contract;
    LedgerEntry ledgerEntry;
}
