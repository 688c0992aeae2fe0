package com.flagship.fund_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.reconciliation.WalletBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class WalletBalanceResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("received")
    BigDecimal received;

    @JsonProperty("spent")
    BigDecimal spent;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("breakdown")
    Breakdown breakdown;

    public static WalletBalanceResponse from(WalletBalance wallet) {
        return WalletBalanceResponse.builder()
            .userId(wallet.getUserId())
            .received(wallet.getReceived())
            .spent(wallet.getSpent())
            .balance(wallet.getBalance())
            .breakdown(new Breakdown(
                wallet.getExpenses(),
                wallet.getBills(),
                wallet.getLedgerNet(),
                wallet.getAllocatedToOthers()))
            .build();
    }

    /**
     * The terms that add up to {@code spent}.
     */
    @Value
    public static class Breakdown {
        @JsonProperty("expenses")
        BigDecimal expenses;

        @JsonProperty("bills")
        BigDecimal bills;

        @JsonProperty("ledger_net")
        BigDecimal ledgerNet;

        @JsonProperty("allocated_to_others")
        BigDecimal allocatedToOthers;
    }
}
