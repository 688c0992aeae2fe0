package com.flagship.fund_ledger.settlement;

import com.flagship.fund_ledger.common.Amounts;
import com.flagship.fund_ledger.ledger.LedgerEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * What a worker is owed right now: pending salary accruals, minus advances
 * that no deduction has offset yet. The net may be zero or negative.
 */
@Value
public class PendingSalary {
    UUID workerId;
    List<LedgerEntry> pendingEntries;
    BigDecimal totalPending;
    List<LedgerEntry> unpaidAdvances;
    BigDecimal totalAdvances;
    BigDecimal netPayable;

    public static PendingSalary of(UUID workerId, List<LedgerEntry> pendingEntries, List<LedgerEntry> unpaidAdvances) {
        BigDecimal totalPending = total(pendingEntries);
        BigDecimal totalAdvances = total(unpaidAdvances);
        return new PendingSalary(workerId, pendingEntries, totalPending, unpaidAdvances, totalAdvances,
            totalPending.subtract(totalAdvances));
    }

    public boolean hasPendingWork() {
        return !pendingEntries.isEmpty();
    }

    /**
     * Amount that actually leaves the allocation.
     */
    public BigDecimal payableAmount() {
        return Amounts.nonNegative(netPayable);
    }

    private static BigDecimal total(List<LedgerEntry> entries) {
        return entries.stream()
            .map(LedgerEntry::getAmount)
            .reduce(Amounts.zero(), BigDecimal::add);
    }
}
