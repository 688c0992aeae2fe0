package com.flagship.fund_ledger.reconciliation;

import com.flagship.fund_ledger.allocation.FundAllocation;
import com.flagship.fund_ledger.allocation.FundAllocationEntity;
import com.flagship.fund_ledger.allocation.FundAllocationRepository;
import com.flagship.fund_ledger.common.exception.ForbiddenException;
import com.flagship.fund_ledger.common.exception.InsufficientFundsException;
import com.flagship.fund_ledger.common.exception.InvalidStateException;
import com.flagship.fund_ledger.common.exception.NotFoundException;
import com.flagship.fund_ledger.identity.Caller;
import com.flagship.fund_ledger.identity.DirectoryService;
import com.flagship.fund_ledger.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Write-side gate in front of every spend.
 *
 * The allocation row is locked before its balance is read, and the lock is
 * held until the surrounding transaction ends. A second spend against the same
 * allocation therefore waits and then sees the first one's rows, so two
 * requests can never both pass the check against the same stale balance.
 *
 * Spending from an allocation also spends from its recipient's wallet, so the
 * check locks the recipient's user row as well, after the allocation row.
 * Outflows funded straight from a wallet take only the user lock. Either way
 * two spends of the same money wait for each other.
 *
 * Callers must run the gate before their own JPA writes: the balance
 * aggregates are plain JDBC and do not flush the persistence context.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FundGate {

    private final FundAllocationRepository allocationRepository;
    private final ReconciliationService reconciliationService;
    private final DirectoryService directoryService;
    private final SettlementMetrics metrics;

    /**
     * Locks the allocation and checks that {@code amount} is available on it.
     *
     * @return the locked allocation
     * @throws NotFoundException if the allocation does not exist
     * @throws ForbiddenException if the caller may not spend from it
     * @throws InvalidStateException if it is not disbursed
     * @throws InsufficientFundsException if the remaining balance is short
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public FundAllocation reserve(Caller caller, UUID allocationId, BigDecimal amount) {
        FundAllocation allocation = lock(caller, allocationId);
        check(allocationId, amount);
        return allocation;
    }

    /**
     * Locks a spendable allocation without checking an amount yet. Bulk
     * settlement locks first and checks once the batch total is known.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public FundAllocation lock(Caller caller, UUID allocationId) {
        FundAllocation allocation = allocationRepository.findByIdForUpdate(allocationId)
            .map(FundAllocationEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("FundAllocation", allocationId));

        if (!allocation.getOrganizationId().equals(caller.getOrganizationId())) {
            throw new ForbiddenException("Access denied to fund allocation");
        }
        if (!caller.isDeveloper() && !allocation.getToUserId().equals(caller.getUserId())) {
            throw new ForbiddenException("Can only spend from fund allocations you received");
        }
        if (!allocation.isDisbursed()) {
            metrics.recordAvailabilityCheck(AvailabilityMessage.ALLOCATION_NOT_DISBURSED.name());
            throw InvalidStateException.notDisbursed(allocationId, allocation.getStatus());
        }
        log.debug("Locked fund allocation {} for spend", allocationId);
        return allocation;
    }

    /**
     * Checks an amount against an allocation the current transaction has
     * already locked, turning a negative outcome into its typed error.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public FundAvailability check(UUID allocationId, BigDecimal amount) {
        allocationRepository.findById(allocationId)
            .ifPresent(allocation -> directoryService.lockUser(allocation.getToUserId()));

        FundAvailability availability = reconciliationService.validateAvailability(allocationId, amount);
        metrics.recordAvailabilityCheck(availability.getMessage().name());

        switch (availability.getMessage()) {
            case OK:
                return availability;
            case ALLOCATION_NOT_FOUND:
                throw new NotFoundException("FundAllocation", allocationId);
            case ALLOCATION_NOT_DISBURSED:
                throw InvalidStateException.notDisbursed(allocationId, "not disbursed");
            case INVALID_AMOUNT:
                throw new IllegalArgumentException("Amount must not be negative");
            default:
                log.warn("Insufficient funds on allocation {}: available={}, requested={}",
                        allocationId, availability.getBalance(), amount);
                throw new InsufficientFundsException(allocationId, availability.getBalance(), amount);
        }
    }

    /**
     * Locks a user's wallet and checks that it covers {@code amount}. Used for
     * outflows that name no allocation: wallet-funded sub-allocations and
     * bills charged to their creator.
     *
     * @throws InsufficientFundsException if the wallet is short
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public WalletBalance reserveWallet(UUID userId, UUID organizationId, BigDecimal amount) {
        directoryService.lockUser(userId);
        WalletBalance wallet = reconciliationService.walletBalance(userId, organizationId);
        if (wallet.getBalance().compareTo(amount) < 0) {
            metrics.recordAvailabilityCheck(AvailabilityMessage.INSUFFICIENT_BALANCE.name());
            log.warn("Wallet of {} cannot cover {}: balance={}", userId, amount, wallet.getBalance());
            throw new InsufficientFundsException(null, wallet.getBalance(), amount);
        }
        metrics.recordAvailabilityCheck(AvailabilityMessage.OK.name());
        return wallet;
    }
}
