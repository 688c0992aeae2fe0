package com.flagship.fund_ledger.ledger;

import com.flagship.fund_ledger.common.Amounts;
import com.flagship.fund_ledger.common.dto.PagedResponse;
import com.flagship.fund_ledger.common.exception.ErrorCode;
import com.flagship.fund_ledger.common.exception.ForbiddenException;
import com.flagship.fund_ledger.common.exception.InvalidStateException;
import com.flagship.fund_ledger.common.exception.NotFoundException;
import com.flagship.fund_ledger.identity.Caller;
import com.flagship.fund_ledger.identity.DirectoryService;
import com.flagship.fund_ledger.identity.Role;
import com.flagship.fund_ledger.identity.UserRecord;
import com.flagship.fund_ledger.reconciliation.FundGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Manual worker ledger operations: entries recorded by managers, their edits
 * and deletion, listings and a worker's balance.
 *
 * Every cash-moving entry names the fund allocation the cash moves through,
 * and a cash-moving credit goes through {@link FundGate} before the row is
 * written. Once recorded, entries change only through settlement or a
 * developer's edit or delete.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkerLedgerService {

    private final WorkerLedgerRepository ledgerRepository;
    private final DirectoryService directoryService;
    private final FundGate fundGate;

    @Transactional
    public LedgerEntry createEntry(Caller caller, CreateLedgerEntryCommand command) {
        requireManager(caller);
        if (command.getType() == null || command.getCategory() == null) {
            throw new IllegalArgumentException("type and category are required");
        }
        BigDecimal amount = Amounts.requirePositive(command.getAmount(), "amount");
        if (command.getCategory().isCashMoving() && command.getFundAllocationId() == null) {
            throw new IllegalArgumentException("A fund allocation is required for " + command.getCategory() + " entries");
        }

        UserRecord worker = requireManageableWorker(caller, command.getWorkerId());
        if (command.getSiteId() != null) {
            directoryService.requireSite(command.getSiteId(), caller.getOrganizationId());
        }
        if (command.getContractId() != null
                && !ledgerRepository.contractExists(command.getContractId(), caller.getOrganizationId())) {
            throw new NotFoundException("Contract", command.getContractId());
        }
        if (command.getLinkedAdvanceId() != null) {
            requireDeductibleAdvance(command, worker.getId());
        }

        LedgerEntry entry = LedgerEntry.builder()
            .id(UUID.randomUUID())
            .organizationId(caller.getOrganizationId())
            .workerId(worker.getId())
            .siteId(command.getSiteId())
            .createdBy(caller.getUserId())
            .fundAllocationId(command.getFundAllocationId())
            .contractId(command.getContractId())
            .linkedAdvanceId(command.getLinkedAdvanceId())
            .type(command.getType())
            .amount(amount)
            .category(command.getCategory())
            .status(initialStatus(command))
            .description(command.getDescription())
            .transactionDate(command.getTransactionDate() != null ? command.getTransactionDate() : LocalDate.now())
            .referenceNumber(command.getReferenceNumber())
            .paymentMode(command.getPaymentMode() != null ? command.getPaymentMode() : PaymentMode.CASH)
            .build();
        if (entry.getStatus() == LedgerStatus.PAID) {
            entry = entry.toBuilder().paidAt(Instant.now()).build();
        }

        if (entry.getFundAllocationId() != null) {
            if (entry.isCashMovingCredit()) {
                fundGate.reserve(caller, entry.getFundAllocationId(), amount);
            } else {
                fundGate.lock(caller, entry.getFundAllocationId());
            }
        }

        LedgerEntry saved = ledgerRepository.insert(entry);
        log.info("Ledger entry created: id={}, worker={}, type={}, category={}, amount={}",
            saved.getId(), saved.getWorkerId(), saved.getType(), saved.getCategory(), saved.getAmount());
        return saved;
    }

    @Transactional(readOnly = true)
    public LedgerEntry getEntry(Caller caller, UUID entryId) {
        LedgerEntry entry = loadInOrganization(caller, entryId);
        if (!visibleWorkers(caller).map(ids -> ids.contains(entry.getWorkerId())).orElse(true)) {
            throw new ForbiddenException("Access denied to ledger entry");
        }
        return entry;
    }

    /**
     * Lists entries, newest transaction date first. Workers see their own
     * entries, engineers and supervisors their own and their team's, developers
     * the whole organization.
     */
    @Transactional(readOnly = true)
    public PagedResponse<LedgerEntry> listEntries(Caller caller, LedgerEntryFilter criteria, int page, int limit) {
        PagedResponse.validate(page, limit);
        LedgerEntryFilter filter = criteria.toBuilder()
            .organizationId(caller.getOrganizationId())
            .visibleWorkerIds(visibleWorkers(caller).orElse(null))
            .build();
        return PagedResponse.of(
            ledgerRepository.find(filter, page, limit), page, limit, ledgerRepository.count(filter));
    }

    /**
     * Developer edit of amount, description, date, reference and payment mode.
     * Raising the amount of a cash-moving credit spends the difference, so the
     * difference is gated against the entry's allocation.
     *
     * Amounts that settlement has already reconciled stay fixed: a paid
     * accrual, a deduction and an advance that a deduction offsets.
     */
    @Transactional
    public LedgerEntry updateEntry(Caller caller, UUID entryId, BigDecimal amount, String description,
                                   LocalDate transactionDate, String referenceNumber, PaymentMode paymentMode) {
        if (!caller.isDeveloper()) {
            throw new ForbiddenException("Only developers can edit ledger entries");
        }
        LedgerEntry current = loadInOrganization(caller, entryId);

        BigDecimal newAmount = amount != null ? Amounts.requirePositive(amount, "amount") : current.getAmount();
        if (newAmount.compareTo(current.getAmount()) != 0) {
            requireAmountEditable(current);
        }
        BigDecimal delta = newAmount.subtract(current.getAmount());
        if (delta.signum() > 0 && current.isCashMovingCredit() && current.getFundAllocationId() != null) {
            fundGate.reserve(caller, current.getFundAllocationId(), delta);
        }

        LedgerEntry updated = current.toBuilder()
            .amount(newAmount)
            .description(description != null ? description : current.getDescription())
            .transactionDate(transactionDate != null ? transactionDate : current.getTransactionDate())
            .referenceNumber(referenceNumber != null ? referenceNumber : current.getReferenceNumber())
            .paymentMode(paymentMode != null ? paymentMode : current.getPaymentMode())
            .build();
        ledgerRepository.updateTerms(updated);

        log.info("Ledger entry {} updated: amount {} -> {}", entryId, current.getAmount(), newAmount);
        return ledgerRepository.findById(entryId).orElseThrow(() -> new NotFoundException("LedgerEntry", entryId));
    }

    /**
     * Deletes an entry. Developer only; an advance that a deduction already
     * offsets, or an entry recorded as an installment payment, stays.
     */
    @Transactional
    public void deleteEntry(Caller caller, UUID entryId) {
        if (!caller.isDeveloper()) {
            throw new ForbiddenException("Only developers can delete ledger entries");
        }
        LedgerEntry entry = loadInOrganization(caller, entryId);
        if (ledgerRepository.hasDeductionFor(entryId) || ledgerRepository.isReferencedByInstallment(entryId)) {
            throw new InvalidStateException(ErrorCode.INVALID_STATE,
                "Ledger entry " + entryId + " is referenced by another record",
                Map.of("entryId", entryId, "category", entry.getCategory()));
        }
        ledgerRepository.delete(entryId);
        log.info("Ledger entry {} deleted by {}", entryId, caller.getUserId());
    }

    @Transactional(readOnly = true)
    public WorkerBalance workerBalance(Caller caller, UUID workerId) {
        UserRecord worker = directoryService.requireUserInOrganization(workerId, caller.getOrganizationId(), "Worker");
        if (!caller.hasAuthorityOver(workerId)) {
            throw new ForbiddenException("Access denied");
        }

        List<WorkerLedgerRepository.CategoryTotal> summary =
            ledgerRepository.summarizeByCategory(caller.getOrganizationId(), workerId);
        BigDecimal credits = Amounts.zero();
        BigDecimal debits = Amounts.zero();
        for (WorkerLedgerRepository.CategoryTotal total : summary) {
            if (total.getType() == EntryType.CREDIT) {
                credits = credits.add(total.getTotal());
            } else {
                debits = debits.add(total.getTotal());
            }
        }

        return WorkerBalance.builder()
            .workerId(workerId)
            .workerName(worker.getName())
            .workerEmail(worker.getEmail())
            .totalCredits(credits)
            .totalDebits(debits)
            .balance(credits.subtract(debits))
            .categorySummary(summary)
            .build();
    }

    /**
     * Loads a worker the caller may manage: in the organization and within the
     * caller's authority.
     */
    public UserRecord requireManageableWorker(Caller caller, UUID workerId) {
        if (workerId == null) {
            throw new IllegalArgumentException("worker_id is required");
        }
        UserRecord worker = directoryService.requireUserInOrganization(workerId, caller.getOrganizationId(), "Worker");
        if (!caller.hasAuthorityOver(workerId)) {
            throw new ForbiddenException("Can only manage ledger for your team members");
        }
        return worker;
    }

    private void requireAmountEditable(LedgerEntry entry) {
        boolean settledAccrual = entry.getCategory() == LedgerCategory.PENDING_SALARY
            && entry.getStatus() == LedgerStatus.PAID;
        boolean deduction = entry.getCategory() == LedgerCategory.DEDUCTION || entry.getLinkedAdvanceId() != null;
        if (settledAccrual || deduction || ledgerRepository.hasDeductionFor(entry.getId())) {
            throw new InvalidStateException(ErrorCode.INVALID_STATE,
                "The amount of ledger entry " + entry.getId() + " is fixed by settlement",
                Map.of("entryId", entry.getId(), "category", entry.getCategory(), "status", entry.getStatus()));
        }
    }

    private void requireManager(Caller caller) {
        if (!caller.hasRole(Role.DEVELOPER, Role.ENGINEER, Role.SUPERVISOR)) {
            throw new ForbiddenException("Insufficient role to manage ledger entries");
        }
    }

    private void requireDeductibleAdvance(CreateLedgerEntryCommand command, UUID workerId) {
        if (command.getCategory() != LedgerCategory.DEDUCTION || command.getType() != EntryType.DEBIT) {
            throw new IllegalArgumentException("Only a debit deduction can reference an advance");
        }
        LedgerEntry advance = ledgerRepository.findById(command.getLinkedAdvanceId())
            .orElseThrow(() -> new NotFoundException("LedgerEntry", command.getLinkedAdvanceId()));
        if (!advance.isAdvance() || !advance.getWorkerId().equals(workerId)) {
            throw new IllegalArgumentException("Linked entry must be an advance of the same worker");
        }
        if (ledgerRepository.hasDeductionFor(advance.getId())) {
            throw new InvalidStateException(ErrorCode.INVALID_STATE,
                "Advance " + advance.getId() + " has already been deducted",
                Map.of("advanceId", advance.getId()));
        }
    }

    private LedgerStatus initialStatus(CreateLedgerEntryCommand command) {
        if (command.getStatus() != null) {
            return command.getStatus();
        }
        return command.getCategory() == LedgerCategory.PENDING_SALARY ? LedgerStatus.PENDING : LedgerStatus.PAID;
    }

    private LedgerEntry loadInOrganization(Caller caller, UUID entryId) {
        return ledgerRepository.findById(entryId)
            .filter(entry -> entry.getOrganizationId().equals(caller.getOrganizationId()))
            .orElseThrow(() -> new NotFoundException("LedgerEntry", entryId));
    }

    /**
     * Workers whose entries the caller may read, or empty for the whole organization.
     */
    private Optional<Set<UUID>> visibleWorkers(Caller caller) {
        if (caller.isDeveloper()) {
            return Optional.empty();
        }
        Set<UUID> visible = new HashSet<>();
        visible.add(caller.getUserId());
        if (!caller.hasRole(Role.WORKER)) {
            visible.addAll(caller.getSubordinateIds());
        }
        return Optional.of(visible);
    }
}
