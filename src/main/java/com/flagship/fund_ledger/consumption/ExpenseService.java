package com.flagship.fund_ledger.consumption;

import com.flagship.fund_ledger.common.Amounts;
import com.flagship.fund_ledger.common.exception.ForbiddenException;
import com.flagship.fund_ledger.common.exception.NotFoundException;
import com.flagship.fund_ledger.identity.Caller;
import com.flagship.fund_ledger.identity.DirectoryService;
import com.flagship.fund_ledger.observability.SettlementMetrics;
import com.flagship.fund_ledger.reconciliation.FundGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Site expenses. Every expense draws on a fund allocation and is gated
 * against it before the row is written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseService {

    private static final Set<ExpenseStatus> REVIEW_OUTCOMES = EnumSet.of(ExpenseStatus.APPROVED, ExpenseStatus.REJECTED);

    private final ExpenseRepository repository;
    private final DirectoryService directoryService;
    private final FundGate fundGate;
    private final SettlementMetrics metrics;

    @Transactional
    public Expense createExpense(Caller caller, CreateExpenseCommand command) {
        BigDecimal amount = Amounts.requirePositive(command.getAmount(), "amount");
        if (command.getSiteId() == null) {
            throw new IllegalArgumentException("siteId is required");
        }
        if (command.getFundAllocationId() == null) {
            throw new IllegalArgumentException("A fund allocation is required for every expense");
        }
        directoryService.requireSite(command.getSiteId(), caller.getOrganizationId());

        fundGate.reserve(caller, command.getFundAllocationId(), amount);

        Expense expense = Expense.create(
            caller.getOrganizationId(),
            command.getSiteId(),
            caller.getUserId(),
            command.getFundAllocationId(),
            amount,
            command.getDescription(),
            command.getVendorName(),
            command.getExpenseDate(),
            caller.isDeveloper()
        );
        Expense saved = repository.save(ExpenseEntity.fromDomain(expense)).toDomain();
        metrics.recordConsumption("expense", saved.getStatus().name());

        log.info("Expense created: id={}, allocation={}, amount={}, status={}",
            saved.getId(), saved.getFundAllocationId(), saved.getAmount(), saved.getStatus());
        return saved;
    }

    /**
     * Approves or rejects a pending expense. Developers may review any
     * expense; other callers only those created by someone below them.
     */
    @Transactional
    public Expense setExpenseStatus(Caller caller, UUID expenseId, ExpenseStatus target) {
        if (target == null || !REVIEW_OUTCOMES.contains(target)) {
            throw new IllegalArgumentException("Expense status must be APPROVED or REJECTED");
        }
        ExpenseEntity entity = repository.findByIdAndOrganizationId(expenseId, caller.getOrganizationId())
            .orElseThrow(() -> new NotFoundException("Expense", expenseId));

        Expense current = entity.toDomain();
        if (!caller.isDeveloper() && !caller.getSubordinateIds().contains(current.getUserId())) {
            throw new ForbiddenException("Only a developer or the creator's manager can review an expense");
        }

        Expense reviewed = current.review(target, caller.getUserId());
        entity.updateFromDomain(reviewed);
        metrics.recordConsumption("expense", target.name());

        log.info("Expense {} moved from {} to {}", expenseId, current.getStatus(), target);
        return entity.toDomain();
    }
}
