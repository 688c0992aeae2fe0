package com.flagship.fund_ledger.allocation;

import com.flagship.fund_ledger.identity.Caller;
import org.springframework.data.jpa.domain.Specification;

import java.util.UUID;

/**
 * Query fragments for listing allocations with role-based visibility.
 */
final class FundAllocationSpecifications {

    private FundAllocationSpecifications() {
    }

    static Specification<FundAllocationEntity> inOrganization(UUID organizationId) {
        return (root, query, cb) -> cb.equal(root.get("organizationId"), organizationId);
    }

    /**
     * Developers see the whole organization, engineers and supervisors the
     * allocations they sent or received, workers only what they received.
     */
    static Specification<FundAllocationEntity> visibleTo(Caller caller) {
        return (root, query, cb) -> switch (caller.getRole()) {
            case DEVELOPER -> cb.conjunction();
            case ENGINEER, SUPERVISOR -> cb.or(
                cb.equal(root.get("fromUserId"), caller.getUserId()),
                cb.equal(root.get("toUserId"), caller.getUserId()));
            case WORKER -> cb.equal(root.get("toUserId"), caller.getUserId());
        };
    }

    static Specification<FundAllocationEntity> withStatus(AllocationStatus status) {
        return (root, query, cb) -> status == null ? cb.conjunction() : cb.equal(root.get("status"), status);
    }

    static Specification<FundAllocationEntity> forSite(UUID siteId) {
        return (root, query, cb) -> siteId == null ? cb.conjunction() : cb.equal(root.get("siteId"), siteId);
    }

    static Specification<FundAllocationEntity> fromUser(UUID userId) {
        return (root, query, cb) -> userId == null ? cb.conjunction() : cb.equal(root.get("fromUserId"), userId);
    }

    static Specification<FundAllocationEntity> toUser(UUID userId) {
        return (root, query, cb) -> userId == null ? cb.conjunction() : cb.equal(root.get("toUserId"), userId);
    }
}
