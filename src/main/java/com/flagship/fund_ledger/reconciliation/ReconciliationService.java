package com.flagship.fund_ledger.reconciliation;

import com.flagship.fund_ledger.allocation.AllocationStatus;
import com.flagship.fund_ledger.common.Amounts;
import com.flagship.fund_ledger.common.exception.NotFoundException;
import com.flagship.fund_ledger.identity.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Derives wallet and allocation balances from the four sources of consumption:
 * expenses, GST bills, cash-moving worker ledger entries and disbursed
 * sub-allocations.
 *
 * Balances are never stored. Every read runs the aggregates below, so a
 * balance cannot drift from the rows that produce it.
 *
 * A spend that names a fund allocation is charged to the wallet of that
 * allocation's recipient, whoever recorded it. A sub-allocation drawn from a
 * source allocation is charged to the source's recipient. Everything else is
 * charged to the user who recorded it. The same money therefore shows up once
 * in the allocation balance and once in the holder's wallet, and an allocation
 * can only be spent while both cover the amount.
 *
 * Self-allocations ({@code from_user_id = to_user_id}) are excluded from both
 * the received and the sub-allocation term of a wallet. Pending, approved and
 * rejected allocations contribute nothing on either side.
 */
@Service
@Slf4j
public class ReconciliationService {

    /** Sum of cash-moving credits minus cash-moving debits over alias {@code l}. */
    private static final String NET_LEDGER =
        "COALESCE(SUM(CASE WHEN l.entry_type = 'CREDIT' THEN l.amount ELSE -l.amount END), 0)";
    private static final String CASH_MOVING = "l.category NOT IN ('PENDING_SALARY', 'DEDUCTION')";

    private final JdbcTemplate jdbcTemplate;

    public ReconciliationService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Wallet of a user: disbursed allocations received from others minus
     * everything the user has spent or passed on.
     */
    @Transactional(readOnly = true)
    public WalletBalance walletBalance(UUID userId, UUID organizationId) {
        BigDecimal received = sum(
            "SELECT COALESCE(SUM(amount), 0) FROM fund_allocations " +
            "WHERE organization_id = ? AND to_user_id = ? AND from_user_id <> ? AND status = 'DISBURSED'",
            organizationId, userId, userId);

        BigDecimal expenses = sum(
            "SELECT COALESCE(SUM(e.amount), 0) FROM expenses e " +
            "LEFT JOIN fund_allocations fa ON fa.id = e.fund_allocation_id " +
            "WHERE e.organization_id = ? AND COALESCE(fa.to_user_id, e.user_id) = ? AND e.status <> 'REJECTED'",
            organizationId, userId);

        // a bill against an allocation is spent when recorded; one without
        // an allocation only once it is credited or paid
        BigDecimal bills = sum(
            "SELECT COALESCE(SUM(b.total_amount), 0) FROM bills b " +
            "LEFT JOIN fund_allocations fa ON fa.id = b.fund_allocation_id " +
            "WHERE b.organization_id = ? AND (" +
            "(b.fund_allocation_id IS NOT NULL AND fa.to_user_id = ? AND b.status <> 'REJECTED') OR " +
            "(b.fund_allocation_id IS NULL AND b.created_by = ? AND b.status IN ('CREDITED', 'PAID')))",
            organizationId, userId, userId);

        BigDecimal ledgerNet = sum(
            "SELECT " + NET_LEDGER + " FROM worker_ledger_entries l " +
            "LEFT JOIN fund_allocations fa ON fa.id = l.fund_allocation_id " +
            "WHERE l.organization_id = ? AND COALESCE(fa.to_user_id, l.created_by) = ? AND " + CASH_MOVING,
            organizationId, userId);

        BigDecimal allocatedToOthers = sum(
            "SELECT COALESCE(SUM(fa.amount), 0) FROM fund_allocations fa " +
            "LEFT JOIN fund_allocations src ON src.id = fa.source_allocation_id " +
            "WHERE fa.organization_id = ? AND COALESCE(src.to_user_id, fa.from_user_id) = ? " +
            "AND fa.from_user_id <> fa.to_user_id AND fa.status = 'DISBURSED'",
            organizationId, userId);

        BigDecimal spent = expenses.add(bills).add(ledgerNet).add(allocatedToOthers);

        log.debug("Wallet computed: userId={}, received={}, spent={}", userId, received, spent);

        return WalletBalance.builder()
            .userId(userId)
            .organizationId(organizationId)
            .received(received)
            .expenses(expenses)
            .bills(bills)
            .ledgerNet(ledgerNet)
            .allocatedToOthers(allocatedToOthers)
            .spent(spent)
            .balance(received.subtract(spent))
            .build();
    }

    /**
     * Remaining balance of one allocation.
     *
     * @throws NotFoundException if the allocation does not exist
     */
    @Transactional(readOnly = true)
    public AllocationBalance allocationBalance(UUID allocationId) {
        List<AllocationHead> heads = jdbcTemplate.query(
            "SELECT amount, status FROM fund_allocations WHERE id = ?",
            (rs, rowNum) -> new AllocationHead(rs.getBigDecimal("amount"),
                AllocationStatus.valueOf(rs.getString("status"))),
            allocationId
        );
        if (heads.isEmpty()) {
            throw new NotFoundException("FundAllocation", allocationId);
        }
        AllocationHead head = heads.get(0);

        BigDecimal expenses = sum(
            "SELECT COALESCE(SUM(amount), 0) FROM expenses WHERE fund_allocation_id = ? AND status <> 'REJECTED'",
            allocationId);

        BigDecimal bills = sum(
            "SELECT COALESCE(SUM(total_amount), 0) FROM bills WHERE fund_allocation_id = ? AND status <> 'REJECTED'",
            allocationId);

        BigDecimal ledgerNet = sum(
            "SELECT " + NET_LEDGER + " FROM worker_ledger_entries l WHERE l.fund_allocation_id = ? AND " + CASH_MOVING,
            allocationId);

        BigDecimal subAllocations = sum(
            "SELECT COALESCE(SUM(amount), 0) FROM fund_allocations " +
            "WHERE source_allocation_id = ? AND status = 'DISBURSED'",
            allocationId);

        BigDecimal allocated = Amounts.normalize(head.amount);
        BigDecimal utilized = expenses.add(bills).add(ledgerNet).add(subAllocations);

        return AllocationBalance.builder()
            .allocationId(allocationId)
            .status(head.status)
            .allocated(allocated)
            .expenses(expenses)
            .bills(bills)
            .ledgerNet(ledgerNet)
            .subAllocations(subAllocations)
            .utilized(utilized)
            .remaining(allocated.subtract(utilized))
            .build();
    }

    /**
     * Fail-closed availability check. A missing allocation, a status other than
     * DISBURSED, a negative amount or a short balance all come back as
     * {@code available = false} with the matching message.
     *
     * The reported balance is what can actually be spent: the allocation's
     * remaining amount, capped by its recipient's wallet unless the recipient
     * is a developer funding from the investment pool.
     */
    @Transactional(readOnly = true)
    public FundAvailability validateAvailability(UUID allocationId, BigDecimal requested) {
        if (allocationId == null) {
            return FundAvailability.of(null, Amounts.zero(), requested, AvailabilityMessage.ALLOCATION_NOT_FOUND);
        }

        AllocationBalance balance;
        try {
            balance = allocationBalance(allocationId);
        } catch (NotFoundException e) {
            return FundAvailability.of(allocationId, Amounts.zero(), requested,
                AvailabilityMessage.ALLOCATION_NOT_FOUND);
        }

        BigDecimal remaining = balance.getRemaining();
        if (balance.getStatus() != AllocationStatus.DISBURSED) {
            return FundAvailability.of(allocationId, remaining, requested,
                AvailabilityMessage.ALLOCATION_NOT_DISBURSED);
        }
        if (requested == null || requested.signum() < 0) {
            return FundAvailability.of(allocationId, remaining, requested, AvailabilityMessage.INVALID_AMOUNT);
        }
        BigDecimal spendable = holderWallet(allocationId)
            .map(wallet -> wallet.min(remaining))
            .orElse(remaining);
        if (spendable.compareTo(requested) < 0) {
            return FundAvailability.of(allocationId, spendable, requested,
                AvailabilityMessage.INSUFFICIENT_BALANCE);
        }
        return FundAvailability.of(allocationId, spendable, requested, AvailabilityMessage.OK);
    }

    /**
     * Wallet balance of the allocation's recipient, or empty when the
     * recipient is a developer.
     */
    private Optional<BigDecimal> holderWallet(UUID allocationId) {
        List<Holder> holders = jdbcTemplate.query(
            "SELECT fa.to_user_id, fa.organization_id, u.role FROM fund_allocations fa " +
            "JOIN users u ON u.id = fa.to_user_id WHERE fa.id = ?",
            (rs, rowNum) -> new Holder(rs.getObject("to_user_id", UUID.class),
                rs.getObject("organization_id", UUID.class), Role.fromLevel(rs.getInt("role"))),
            allocationId
        );
        return holders.stream()
            .filter(holder -> holder.role != Role.DEVELOPER)
            .findFirst()
            .map(holder -> walletBalance(holder.userId, holder.organizationId).getBalance());
    }

    private BigDecimal sum(String sql, Object... args) {
        BigDecimal value = jdbcTemplate.queryForObject(sql, BigDecimal.class, args);
        return Amounts.normalize(value);
    }

    private static final class Holder {
        private final UUID userId;
        private final UUID organizationId;
        private final Role role;

        private Holder(UUID userId, UUID organizationId, Role role) {
            this.userId = userId;
            this.organizationId = organizationId;
            this.role = role;
        }
    }

    private static final class AllocationHead {
        private final BigDecimal amount;
        private final AllocationStatus status;

        private AllocationHead(BigDecimal amount, AllocationStatus status) {
            this.amount = amount;
            this.status = status;
        }
    }
}
