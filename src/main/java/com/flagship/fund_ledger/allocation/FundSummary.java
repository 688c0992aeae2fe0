package com.flagship.fund_ledger.allocation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A user's view of money moving through them: what they received, what they
 * passed on, what is still on its way, and the resulting wallet balance.
 */
@Value
@Builder
public class FundSummary {

    @JsonProperty("total_received")
    BigDecimal totalReceived;

    @JsonProperty("received_count")
    long receivedCount;

    @JsonProperty("total_disbursed")
    BigDecimal totalDisbursed;

    @JsonProperty("disbursed_count")
    long disbursedCount;

    @JsonProperty("pending_to_receive")
    BigDecimal pendingToReceive;

    @JsonProperty("pending_count")
    long pendingCount;

    @JsonProperty("wallet_balance")
    BigDecimal walletBalance;
}
