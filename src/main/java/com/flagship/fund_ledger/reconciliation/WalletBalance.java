package com.flagship.fund_ledger.reconciliation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Spendable position of one user in one organization, with the terms that
 * make up {@code spent}.
 */
@Value
@Builder
public class WalletBalance {
    UUID userId;
    UUID organizationId;
    BigDecimal received;
    BigDecimal expenses;
    BigDecimal bills;
    BigDecimal ledgerNet;
    BigDecimal allocatedToOthers;
    BigDecimal spent;
    BigDecimal balance;
}
