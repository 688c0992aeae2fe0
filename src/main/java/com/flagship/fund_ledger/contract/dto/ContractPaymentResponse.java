package com.flagship.fund_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.contract.ContractPayment;
import com.flagship.fund_ledger.ledger.dto.LedgerEntryResponse;
import lombok.Value;

@Value
public class ContractPaymentResponse {

    @JsonProperty("contract")
    ContractResponse contract;

    @JsonProperty("ledger_entry")
    LedgerEntryResponse ledgerEntry;

    public static ContractPaymentResponse from(ContractPayment payment) {
        return new ContractPaymentResponse(
            ContractResponse.from(payment.getContract()),
            LedgerEntryResponse.from(payment.getLedgerEntry()));
    }
}
