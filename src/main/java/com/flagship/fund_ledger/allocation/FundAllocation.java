package com.flagship.fund_ledger.allocation;

import com.flagship.fund_ledger.common.exception.ErrorCode;
import com.flagship.fund_ledger.common.exception.InvalidStateException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * Fund allocation domain object: a directed transfer of a fixed amount from
 * one user to another, optionally scoped to a site and funded from an earlier
 * allocation.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - State changes are immutable (a transition returns a new instance)
 * - The amount cannot change once the allocation is disbursed
 */
@Value
@Builder(toBuilder = true)
public class FundAllocation {
    UUID id;
    UUID organizationId;
    UUID fromUserId;
    UUID toUserId;
    UUID siteId;
    UUID sourceAllocationId;
    BigDecimal amount;
    AllocationPurpose purpose;
    String description;
    String referenceNumber;
    AllocationStatus status;
    LocalDate allocationDate;
    Instant disbursedAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new allocation. Developer allocations are disbursed straight
     * away; everyone else's start PENDING.
     */
    public static FundAllocation create(UUID organizationId, UUID fromUserId, UUID toUserId, UUID siteId,
                                        UUID sourceAllocationId, BigDecimal amount, AllocationPurpose purpose,
                                        String description, String referenceNumber, boolean autoDisburse) {
        Instant now = Instant.now();
        return FundAllocation.builder()
            .id(UUID.randomUUID())
            .organizationId(organizationId)
            .fromUserId(fromUserId)
            .toUserId(toUserId)
            .siteId(siteId)
            .sourceAllocationId(sourceAllocationId)
            .amount(amount)
            .purpose(purpose == null ? AllocationPurpose.SITE_EXPENSE : purpose)
            .description(description)
            .referenceNumber(referenceNumber)
            .status(autoDisburse ? AllocationStatus.DISBURSED : AllocationStatus.PENDING)
            .allocationDate(LocalDate.now())
            .disbursedAt(autoDisburse ? now : null)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Moves the allocation to the target status.
     *
     * @throws InvalidStateException if the transition is not allowed
     */
    public FundAllocation transitionTo(AllocationStatus target) {
        if (!canTransitionTo(target)) {
            throw InvalidStateException.invalidTransition(id, status, target);
        }
        Instant now = Instant.now();
        return toBuilder()
            .status(target)
            .disbursedAt(target == AllocationStatus.DISBURSED ? now : disbursedAt)
            .updatedAt(now)
            .build();
    }

    /**
     * Checks if a transition from the current status to the target is allowed.
     * Re-applying the current status is not a transition.
     */
    public boolean canTransitionTo(AllocationStatus target) {
        return switch (status) {
            case PENDING -> target == AllocationStatus.APPROVED
                || target == AllocationStatus.REJECTED
                || target == AllocationStatus.DISBURSED;
            case APPROVED -> target == AllocationStatus.DISBURSED || target == AllocationStatus.REJECTED;
            case DISBURSED, REJECTED -> false;
        };
    }

    /**
     * Edits the mutable terms of an allocation that has not been settled yet.
     *
     * @throws InvalidStateException once the allocation is disbursed or rejected
     */
    public FundAllocation withTerms(BigDecimal newAmount, AllocationPurpose newPurpose, String newDescription) {
        if (status.isTerminal()) {
            throw new InvalidStateException(ErrorCode.INVALID_STATE,
                String.format("Cannot edit allocation %s in %s status", id, status),
                Map.of("allocationId", id, "status", status));
        }
        return toBuilder()
            .amount(newAmount != null ? newAmount : amount)
            .purpose(newPurpose != null ? newPurpose : purpose)
            .description(newDescription != null ? newDescription : description)
            .updatedAt(Instant.now())
            .build();
    }

    public boolean isDisbursed() {
        return status == AllocationStatus.DISBURSED;
    }

    /**
     * A self-allocation moves money a user already holds; it never counts as
     * received or spent in that user's wallet.
     */
    public boolean isSelfAllocation() {
        return fromUserId.equals(toUserId);
    }
}
