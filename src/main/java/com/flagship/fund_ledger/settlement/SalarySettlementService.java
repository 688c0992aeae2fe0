package com.flagship.fund_ledger.settlement;

import com.flagship.fund_ledger.allocation.FundAllocation;
import com.flagship.fund_ledger.common.Amounts;
import com.flagship.fund_ledger.common.exception.EmptySelectionException;
import com.flagship.fund_ledger.common.exception.NoPendingWorkException;
import com.flagship.fund_ledger.identity.Caller;
import com.flagship.fund_ledger.identity.DirectoryService;
import com.flagship.fund_ledger.identity.UserRecord;
import com.flagship.fund_ledger.ledger.EntryType;
import com.flagship.fund_ledger.ledger.LedgerCategory;
import com.flagship.fund_ledger.ledger.LedgerEntry;
import com.flagship.fund_ledger.ledger.LedgerStatus;
import com.flagship.fund_ledger.ledger.PaymentMode;
import com.flagship.fund_ledger.ledger.WorkerLedgerRepository;
import com.flagship.fund_ledger.ledger.WorkerLedgerService;
import com.flagship.fund_ledger.observability.CorrelationContext;
import com.flagship.fund_ledger.observability.SettlementMetrics;
import com.flagship.fund_ledger.outbox.OutboxPublisher;
import com.flagship.fund_ledger.outbox.OutboxService;
import com.flagship.fund_ledger.reconciliation.FundGate;
import com.flagship.fund_ledger.settlement.event.BulkSalarySettledEvent;
import com.flagship.fund_ledger.settlement.event.SalarySettledEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Pays workers their pending salary out of a fund allocation.
 *
 * A settlement runs in one transaction:
 * 1. Lock the allocation and require it to be disbursed
 * 2. Collect (and lock) pending salary, collect unpaid advances
 * 3. Check the net payable against the allocation
 * 4. Mark the accruals paid, write one deduction per advance and one salary credit for the net
 *
 * Any failure rolls the whole unit back, so the ledger is either fully
 * settled or untouched. Accruals and deductions do not move cash; only the
 * salary credit consumes the allocation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SalarySettlementService {

    private static final String SINGLE = "single";
    private static final String BULK = "bulk";

    private final WorkerLedgerRepository ledgerRepository;
    private final WorkerLedgerService ledgerService;
    private final DirectoryService directoryService;
    private final FundGate fundGate;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;

    /**
     * Pending salary aggregate for one worker, without locking anything.
     */
    @Transactional(readOnly = true)
    public PendingSalary pendingSalary(Caller caller, UUID workerId, SettlementOptions options) {
        UserRecord worker = ledgerService.requireManageableWorker(caller, workerId);
        return collect(caller.getOrganizationId(), worker.getId(), options, false);
    }

    /**
     * Settles one worker against one allocation.
     *
     * @throws com.flagship.fund_ledger.common.exception.NotFoundException if the worker or allocation is missing
     * @throws com.flagship.fund_ledger.common.exception.ForbiddenException if the caller lacks authority
     * @throws com.flagship.fund_ledger.common.exception.InvalidStateException if the allocation is not disbursed
     * @throws NoPendingWorkException if there is nothing to pay
     * @throws com.flagship.fund_ledger.common.exception.InsufficientFundsException if the allocation cannot cover the net
     */
    @Transactional
    public SettlementSummary paySalary(Caller caller, UUID workerId, UUID allocationId, SettlementOptions options) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.WORKER_ID_MDC_KEY, String.valueOf(workerId));
        MDC.put(CorrelationContext.ALLOCATION_ID_MDC_KEY, String.valueOf(allocationId));

        log.info("Attempting salary settlement");

        try {
            UserRecord worker = ledgerService.requireManageableWorker(caller, workerId);
            FundAllocation allocation = fundGate.lock(caller, allocationId);

            PendingSalary pending = collect(caller.getOrganizationId(), worker.getId(), options, true);
            if (!pending.hasPendingWork()) {
                throw new NoPendingWorkException(workerId);
            }

            fundGate.check(allocationId, pending.payableAmount());

            stage(caller, allocation, pending, options);
            UUID paymentEntryId = writeSalaryPayment(caller, allocation, worker.getId(), pending.payableAmount(), options);

            SettlementSummary summary = summarize(worker.getId(), allocationId, pending, paymentEntryId);
            outboxService.saveEvent(OutboxPublisher.SETTLEMENT_AGGREGATE, worker.getId(),
                SalarySettledEvent.EVENT_TYPE, SalarySettledEvent.from(summary, caller.getUserId()));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordSettlement(SINGLE, "success");
            metrics.recordSettlementLatency(SINGLE, duration);

            log.info("Salary settled: gross={}, advances={}, netPaid={}, entries={}, duration={}ms",
                summary.getGross(), summary.getAdvancesDeducted(), summary.getNetPaid(),
                summary.getPendingEntriesSettled(), duration);
            return summary;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordSettlement(SINGLE, "error");
            metrics.recordSettlementLatency(SINGLE, duration);
            log.warn("Salary settlement failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.WORKER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ALLOCATION_ID_MDC_KEY);
        }
    }

    /**
     * Settles a selection of workers against one allocation, all or nothing.
     *
     * Workers that do not exist, that the caller has no authority over, or
     * that have nothing pending are skipped. The remaining workers are staged
     * first and the allocation is checked once against the sum of their net
     * payables; a shortfall rolls back every staged change.
     *
     * @throws EmptySelectionException if the list is empty or every worker was skipped
     */
    @Transactional
    public BulkSettlementSummary bulkPaySalary(Caller caller, List<UUID> workerIds, UUID allocationId,
                                               SettlementOptions options) {
        long startTime = System.currentTimeMillis();
        if (workerIds == null || workerIds.isEmpty()) {
            throw new EmptySelectionException("No workers selected", 0);
        }
        Set<UUID> selection = new LinkedHashSet<>(workerIds);
        MDC.put(CorrelationContext.ALLOCATION_ID_MDC_KEY, String.valueOf(allocationId));

        log.info("Attempting bulk salary settlement for {} worker(s)", selection.size());

        try {
            FundAllocation allocation = fundGate.lock(caller, allocationId);

            List<StagedWorker> staged = new ArrayList<>();
            for (UUID workerId : selection) {
                Optional<UserRecord> worker = eligibleWorker(caller, workerId);
                if (worker.isEmpty()) {
                    log.debug("Skipping worker {}: missing or outside caller authority", workerId);
                    continue;
                }
                PendingSalary pending = collect(caller.getOrganizationId(), workerId, options, true);
                if (!pending.hasPendingWork()) {
                    log.debug("Skipping worker {}: nothing pending", workerId);
                    continue;
                }
                stage(caller, allocation, pending, options);
                staged.add(new StagedWorker(workerId, pending));
            }

            if (staged.isEmpty()) {
                throw new EmptySelectionException("None of the selected workers has pending salary", selection.size());
            }

            BigDecimal totalNet = staged.stream()
                .map(worker -> worker.pending.payableAmount())
                .reduce(Amounts.zero(), BigDecimal::add);
            fundGate.check(allocationId, totalNet);

            List<SettlementSummary> summaries = new ArrayList<>();
            BigDecimal totalGross = Amounts.zero();
            BigDecimal totalAdvances = Amounts.zero();
            for (StagedWorker worker : staged) {
                UUID paymentEntryId = writeSalaryPayment(
                    caller, allocation, worker.workerId, worker.pending.payableAmount(), options);
                summaries.add(summarize(worker.workerId, allocationId, worker.pending, paymentEntryId));
                totalGross = totalGross.add(worker.pending.getTotalPending());
                totalAdvances = totalAdvances.add(worker.pending.getTotalAdvances());
            }

            BulkSettlementSummary summary = BulkSettlementSummary.builder()
                .allocationId(allocationId)
                .workersRequested(selection.size())
                .workersProcessed(summaries.size())
                .totalGross(totalGross)
                .totalAdvances(totalAdvances)
                .totalNet(totalNet)
                .workers(List.copyOf(summaries))
                .build();

            outboxService.saveEvent(OutboxPublisher.SETTLEMENT_AGGREGATE, allocationId,
                BulkSalarySettledEvent.EVENT_TYPE, BulkSalarySettledEvent.from(summary, caller.getUserId()));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordSettlement(BULK, "success");
            metrics.recordSettlementLatency(BULK, duration);

            log.info("Bulk salary settled: workers={}/{}, totalNet={}, duration={}ms",
                summary.getWorkersProcessed(), selection.size(), totalNet, duration);
            return summary;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordSettlement(BULK, "error");
            metrics.recordSettlementLatency(BULK, duration);
            log.warn("Bulk salary settlement failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ALLOCATION_ID_MDC_KEY);
        }
    }

    private PendingSalary collect(UUID organizationId, UUID workerId, SettlementOptions options, boolean lock) {
        List<LedgerEntry> pendingEntries = ledgerRepository.findPendingSalary(organizationId, workerId,
            options.getSiteId(), options.getStartDate(), options.getEndDate(), lock);
        List<LedgerEntry> advances = ledgerRepository.findUnpaidAdvances(organizationId, workerId);
        return PendingSalary.of(workerId, pendingEntries, advances);
    }

    private Optional<UserRecord> eligibleWorker(Caller caller, UUID workerId) {
        return directoryService.findUser(workerId)
            .filter(user -> caller.getOrganizationId().equals(user.getOrganizationId()))
            .filter(user -> caller.hasAuthorityOver(user.getId()));
    }

    /**
     * Marks accruals paid and offsets advances. Neither moves cash, so staging
     * leaves the allocation balance unchanged.
     */
    private void stage(Caller caller, FundAllocation allocation, PendingSalary pending, SettlementOptions options) {
        List<UUID> pendingIds = pending.getPendingEntries().stream().map(LedgerEntry::getId).toList();
        int marked = ledgerRepository.markPaid(pendingIds, allocation.getId());
        if (marked != pendingIds.size()) {
            throw new IllegalStateException(String.format(
                "Pending salary of worker %s changed during settlement: expected %d, marked %d",
                pending.getWorkerId(), pendingIds.size(), marked));
        }

        for (LedgerEntry advance : pending.getUnpaidAdvances()) {
            ledgerRepository.insert(newEntry(caller, allocation, pending.getWorkerId(), options)
                .type(EntryType.DEBIT)
                .category(LedgerCategory.DEDUCTION)
                .amount(advance.getAmount())
                .siteId(advance.getSiteId())
                .linkedAdvanceId(advance.getId())
                .description("Advance deduction against salary")
                .build());
        }
    }

    private UUID writeSalaryPayment(Caller caller, FundAllocation allocation, UUID workerId, BigDecimal amount,
                                    SettlementOptions options) {
        if (amount.signum() <= 0) {
            return null;
        }
        LedgerEntry payment = ledgerRepository.insert(newEntry(caller, allocation, workerId, options)
            .type(EntryType.CREDIT)
            .category(LedgerCategory.SALARY)
            .amount(amount)
            .description(options.getDescription() != null ? options.getDescription() : "Salary payment")
            .build());
        return payment.getId();
    }

    private LedgerEntry.LedgerEntryBuilder newEntry(Caller caller, FundAllocation allocation, UUID workerId,
                                                    SettlementOptions options) {
        return LedgerEntry.builder()
            .id(UUID.randomUUID())
            .organizationId(caller.getOrganizationId())
            .workerId(workerId)
            .siteId(options.getSiteId() != null ? options.getSiteId() : allocation.getSiteId())
            .createdBy(caller.getUserId())
            .fundAllocationId(allocation.getId())
            .status(LedgerStatus.PAID)
            .transactionDate(LocalDate.now())
            .referenceNumber(options.getReferenceNumber())
            .paymentMode(options.getPaymentMode() != null ? options.getPaymentMode() : PaymentMode.CASH)
            .paidAt(Instant.now());
    }

    private SettlementSummary summarize(UUID workerId, UUID allocationId, PendingSalary pending, UUID paymentEntryId) {
        return SettlementSummary.builder()
            .workerId(workerId)
            .allocationId(allocationId)
            .gross(pending.getTotalPending())
            .advancesDeducted(pending.getTotalAdvances())
            .netPayable(pending.getNetPayable())
            .netPaid(pending.payableAmount())
            .pendingEntriesSettled(pending.getPendingEntries().size())
            .advancesSettled(pending.getUnpaidAdvances().size())
            .paymentEntryId(paymentEntryId)
            .build();
    }

    private static final class StagedWorker {
        private final UUID workerId;
        private final PendingSalary pending;

        private StagedWorker(UUID workerId, PendingSalary pending) {
            this.workerId = workerId;
            this.pending = pending;
        }
    }
}
