package com.flagship.fund_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.reconciliation.AvailabilityMessage;
import com.flagship.fund_ledger.reconciliation.FundAvailability;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class FundAvailabilityResponse {

    @JsonProperty("available")
    boolean available;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("requested")
    BigDecimal requested;

    @JsonProperty("message")
    AvailabilityMessage message;

    public static FundAvailabilityResponse from(FundAvailability availability) {
        return new FundAvailabilityResponse(
            availability.isAvailable(),
            availability.getBalance(),
            availability.getRequested(),
            availability.getMessage()
        );
    }
}
