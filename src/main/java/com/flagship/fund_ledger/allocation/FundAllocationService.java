package com.flagship.fund_ledger.allocation;

import com.flagship.fund_ledger.allocation.event.FundAllocationCreatedEvent;
import com.flagship.fund_ledger.allocation.event.FundAllocationStatusChangedEvent;
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
import com.flagship.fund_ledger.observability.CorrelationContext;
import com.flagship.fund_ledger.observability.SettlementMetrics;
import com.flagship.fund_ledger.outbox.OutboxPublisher;
import com.flagship.fund_ledger.outbox.OutboxService;
import com.flagship.fund_ledger.reconciliation.FundGate;
import com.flagship.fund_ledger.reconciliation.ReconciliationService;
import com.flagship.fund_ledger.reconciliation.WalletBalance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Lifecycle of fund allocations: creation, status changes, edits and deletion.
 *
 * Every path that makes money leave a wallet or a source allocation checks
 * funding inside the same transaction as the write:
 * - creation from a source allocation goes through {@link FundGate}
 * - creation by an engineer or supervisor checks their wallet
 * - disbursing a pending allocation re-checks whichever of the two applies
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FundAllocationService {

    private static final Set<AllocationStatus> SETTABLE_STATUSES =
        EnumSet.of(AllocationStatus.APPROVED, AllocationStatus.REJECTED, AllocationStatus.DISBURSED);

    private static final String REFERENCE_COUNT_SQL =
        "SELECT (SELECT COUNT(*) FROM expenses WHERE fund_allocation_id = ?)" +
        " + (SELECT COUNT(*) FROM bills WHERE fund_allocation_id = ?)" +
        " + (SELECT COUNT(*) FROM worker_ledger_entries WHERE fund_allocation_id = ?)" +
        " + (SELECT COUNT(*) FROM contracts WHERE fund_allocation_id = ?)" +
        " + (SELECT COUNT(*) FROM fund_allocations WHERE source_allocation_id = ?)";

    private final FundAllocationRepository repository;
    private final DirectoryService directoryService;
    private final ReconciliationService reconciliationService;
    private final FundGate fundGate;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;
    private final JdbcTemplate jdbcTemplate;

    /**
     * Creates an allocation from the caller to {@code command.toUserId}.
     *
     * Developers fund allocations from the investment pool, so theirs are
     * disbursed immediately. Engineers and supervisors may only allocate to
     * themselves or their subordinates, out of their own wallet or out of a
     * source allocation they received; theirs start PENDING.
     */
    @Transactional
    public FundAllocation createAllocation(Caller caller, CreateAllocationCommand command) {
        if (caller.hasRole(Role.WORKER)) {
            throw new ForbiddenException("Workers cannot allocate funds");
        }
        BigDecimal amount = Amounts.requirePositive(command.getAmount(), "amount");

        UserRecord recipient = directoryService.requireUserInOrganization(
            command.getToUserId(), caller.getOrganizationId(), "User");
        if (!caller.hasAuthorityOver(recipient.getId())) {
            throw new ForbiddenException("Can only allocate funds to yourself or your team members");
        }
        if (command.getSiteId() != null) {
            directoryService.requireSite(command.getSiteId(), caller.getOrganizationId());
        }

        boolean selfAllocation = recipient.getId().equals(caller.getUserId());
        if (selfAllocation && command.getSourceAllocationId() != null) {
            throw new IllegalArgumentException("A self-allocation cannot draw from a source allocation");
        }

        if (command.getSourceAllocationId() != null) {
            fundGate.reserve(caller, command.getSourceAllocationId(), amount);
        } else if (!caller.isDeveloper()) {
            fundGate.reserveWallet(caller.getUserId(), caller.getOrganizationId(), amount);
        }

        FundAllocation allocation = FundAllocation.create(
            caller.getOrganizationId(),
            caller.getUserId(),
            recipient.getId(),
            command.getSiteId(),
            command.getSourceAllocationId(),
            amount,
            command.getPurpose(),
            command.getDescription(),
            command.getReferenceNumber(),
            caller.isDeveloper()
        );

        FundAllocation saved = repository.save(FundAllocationEntity.fromDomain(allocation)).toDomain();

        outboxService.saveEvent(OutboxPublisher.ALLOCATION_AGGREGATE, saved.getId(),
            FundAllocationCreatedEvent.EVENT_TYPE, FundAllocationCreatedEvent.from(saved));
        metrics.recordAllocationTransition(saved.getStatus().name());

        log.info("Fund allocation created: id={}, from={}, to={}, amount={}, status={}",
            saved.getId(), saved.getFromUserId(), saved.getToUserId(), saved.getAmount(), saved.getStatus());
        return saved;
    }

    /**
     * Moves an allocation to APPROVED, REJECTED or DISBURSED.
     *
     * A developer may apply any allowed transition. Anyone else may only mark
     * an allocation they received as DISBURSED, which confirms receipt.
     */
    @Transactional
    public FundAllocation setAllocationStatus(Caller caller, UUID allocationId, AllocationStatus target) {
        if (target == null || !SETTABLE_STATUSES.contains(target)) {
            throw new IllegalArgumentException("Status must be one of " + SETTABLE_STATUSES);
        }
        MDC.put(CorrelationContext.ALLOCATION_ID_MDC_KEY, allocationId.toString());
        try {
            FundAllocationEntity entity = repository.findByIdForUpdate(allocationId)
                .filter(found -> found.getOrganizationId().equals(caller.getOrganizationId()))
                .orElseThrow(() -> new NotFoundException("FundAllocation", allocationId));
            FundAllocation current = entity.toDomain();

            if (!caller.isDeveloper()) {
                boolean recipient = current.getToUserId().equals(caller.getUserId());
                if (!recipient || target != AllocationStatus.DISBURSED) {
                    throw new ForbiddenException("Only the recipient can confirm a fund allocation as disbursed");
                }
            }

            FundAllocation updated = current.transitionTo(target);
            if (target == AllocationStatus.DISBURSED) {
                requireFundingForDisbursement(current);
            }

            entity.updateFromDomain(updated);
            FundAllocation saved = repository.save(entity).toDomain();

            outboxService.saveEvent(OutboxPublisher.ALLOCATION_AGGREGATE, saved.getId(),
                FundAllocationStatusChangedEvent.EVENT_TYPE,
                FundAllocationStatusChangedEvent.from(saved, current.getStatus(), caller.getUserId()));
            metrics.recordAllocationTransition(target.name());

            log.info("Fund allocation status changed: {} -> {}", current.getStatus(), target);
            return saved;
        } finally {
            MDC.remove(CorrelationContext.ALLOCATION_ID_MDC_KEY);
        }
    }

    /**
     * Edits amount, purpose or description of an allocation that is neither
     * disbursed nor rejected. Only the creator or a developer may edit.
     */
    @Transactional
    public FundAllocation updateAllocation(Caller caller, UUID allocationId, BigDecimal amount,
                                           AllocationPurpose purpose, String description) {
        FundAllocationEntity entity = loadInOrganization(caller, allocationId);
        FundAllocation current = entity.toDomain();

        if (!caller.isDeveloper() && !current.getFromUserId().equals(caller.getUserId())) {
            throw new ForbiddenException("Can only edit fund allocations you created");
        }

        BigDecimal newAmount = amount != null ? Amounts.requirePositive(amount, "amount") : null;
        FundAllocation updated = current.withTerms(newAmount, purpose, description);

        entity.updateFromDomain(updated);
        FundAllocation saved = repository.save(entity).toDomain();
        log.info("Fund allocation {} updated: amount={}, purpose={}", allocationId, saved.getAmount(), saved.getPurpose());
        return saved;
    }

    /**
     * Deletes an allocation. Developer only, and only while nothing consumes it.
     */
    @Transactional
    public void deleteAllocation(Caller caller, UUID allocationId) {
        if (!caller.isDeveloper()) {
            throw new ForbiddenException("Only developers can delete fund allocations");
        }
        FundAllocationEntity entity = loadInOrganization(caller, allocationId);

        long references = countReferences(allocationId);
        if (references > 0) {
            throw new InvalidStateException(ErrorCode.ALLOCATION_IN_USE,
                String.format("Fund allocation %s is referenced by %d record(s)", allocationId, references),
                Map.of("allocationId", allocationId, "references", references));
        }

        repository.delete(entity);
        log.info("Fund allocation {} deleted by {}", allocationId, caller.getUserId());
    }

    @Transactional(readOnly = true)
    public FundAllocation getAllocation(Caller caller, UUID allocationId) {
        FundAllocation allocation = loadInOrganization(caller, allocationId).toDomain();
        if (!isVisible(caller, allocation)) {
            throw new ForbiddenException("Access denied to fund allocation");
        }
        return allocation;
    }

    /**
     * Lists allocations visible to the caller, newest first.
     */
    @Transactional(readOnly = true)
    public PagedResponse<FundAllocation> listAllocations(Caller caller, AllocationStatus status, UUID siteId,
                                                         UUID fromUserId, UUID toUserId, int page, int limit) {
        PagedResponse.validate(page, limit);

        Specification<FundAllocationEntity> specification = Specification
            .where(FundAllocationSpecifications.inOrganization(caller.getOrganizationId()))
            .and(FundAllocationSpecifications.visibleTo(caller))
            .and(FundAllocationSpecifications.withStatus(status))
            .and(FundAllocationSpecifications.forSite(siteId))
            .and(FundAllocationSpecifications.fromUser(fromUserId))
            .and(FundAllocationSpecifications.toUser(toUserId));

        Page<FundAllocationEntity> result = repository.findAll(specification,
            PageRequest.of(page - 1, limit, Sort.by(Sort.Direction.DESC, "createdAt")));

        return PagedResponse.of(
            result.getContent().stream().map(FundAllocationEntity::toDomain).toList(),
            page, limit, result.getTotalElements());
    }

    /**
     * Totals of what the caller received, passed on and is still waiting for.
     */
    @Transactional(readOnly = true)
    public FundSummary getFundSummary(Caller caller) {
        UUID organizationId = caller.getOrganizationId();
        UUID userId = caller.getUserId();
        Set<AllocationStatus> disbursed = EnumSet.of(AllocationStatus.DISBURSED);
        Set<AllocationStatus> inFlight = EnumSet.of(AllocationStatus.PENDING, AllocationStatus.APPROVED);

        WalletBalance wallet = reconciliationService.walletBalance(userId, organizationId);

        return FundSummary.builder()
            .totalReceived(Amounts.normalize(repository.sumReceivedFromOthers(organizationId, userId, disbursed)))
            .receivedCount(repository.countReceivedFromOthers(organizationId, userId, disbursed))
            .totalDisbursed(Amounts.normalize(repository.sumSentToOthers(organizationId, userId, disbursed)))
            .disbursedCount(repository.countSentToOthers(organizationId, userId, disbursed))
            .pendingToReceive(Amounts.normalize(repository.sumReceivedFromOthers(organizationId, userId, inFlight)))
            .pendingCount(repository.countReceivedFromOthers(organizationId, userId, inFlight))
            .walletBalance(wallet.getBalance())
            .build();
    }

    private void requireFundingForDisbursement(FundAllocation allocation) {
        if (allocation.getSourceAllocationId() != null) {
            UUID sourceId = allocation.getSourceAllocationId();
            repository.findByIdForUpdate(sourceId)
                .orElseThrow(() -> new NotFoundException("FundAllocation", sourceId));
            fundGate.check(sourceId, allocation.getAmount());
            return;
        }
        UserRecord creator = directoryService.findUser(allocation.getFromUserId())
            .orElseThrow(() -> new NotFoundException("User", allocation.getFromUserId()));
        if (creator.getRole() != Role.DEVELOPER) {
            fundGate.reserveWallet(creator.getId(), allocation.getOrganizationId(), allocation.getAmount());
        }
    }

    private FundAllocationEntity loadInOrganization(Caller caller, UUID allocationId) {
        return repository.findById(allocationId)
            .filter(entity -> entity.getOrganizationId().equals(caller.getOrganizationId()))
            .orElseThrow(() -> new NotFoundException("FundAllocation", allocationId));
    }

    private boolean isVisible(Caller caller, FundAllocation allocation) {
        if (caller.isDeveloper()) {
            return true;
        }
        boolean recipient = allocation.getToUserId().equals(caller.getUserId());
        if (caller.hasRole(Role.WORKER)) {
            return recipient;
        }
        return recipient || allocation.getFromUserId().equals(caller.getUserId());
    }

    private long countReferences(UUID allocationId) {
        Long count = jdbcTemplate.queryForObject(REFERENCE_COUNT_SQL, Long.class,
            allocationId, allocationId, allocationId, allocationId, allocationId);
        return count != null ? count : 0L;
    }
}
