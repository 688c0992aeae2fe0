package com.flagship.fund_ledger.allocation;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FundAllocationRepository extends JpaRepository<FundAllocationEntity, UUID>,
        JpaSpecificationExecutor<FundAllocationEntity> {

    /**
     * Loads an allocation and takes a row lock for the rest of the transaction.
     * Every balance-gated write goes through this so that two spends against the
     * same allocation serialize on the store instead of racing a stale balance.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM FundAllocationEntity a WHERE a.id = :id")
    Optional<FundAllocationEntity> findByIdForUpdate(@Param("id") UUID id);

    boolean existsBySourceAllocationId(UUID sourceAllocationId);

    // Sums below return null when nothing matches.

    @Query("""
        SELECT SUM(a.amount) FROM FundAllocationEntity a
        WHERE a.organizationId = :organizationId AND a.toUserId = :userId
          AND a.fromUserId <> :userId AND a.status IN :statuses
        """)
    BigDecimal sumReceivedFromOthers(@Param("organizationId") UUID organizationId,
                                     @Param("userId") UUID userId,
                                     @Param("statuses") Collection<AllocationStatus> statuses);

    @Query("""
        SELECT COUNT(a) FROM FundAllocationEntity a
        WHERE a.organizationId = :organizationId AND a.toUserId = :userId
          AND a.fromUserId <> :userId AND a.status IN :statuses
        """)
    long countReceivedFromOthers(@Param("organizationId") UUID organizationId,
                                 @Param("userId") UUID userId,
                                 @Param("statuses") Collection<AllocationStatus> statuses);

    @Query("""
        SELECT SUM(a.amount) FROM FundAllocationEntity a
        WHERE a.organizationId = :organizationId AND a.fromUserId = :userId
          AND a.toUserId <> :userId AND a.status IN :statuses
        """)
    BigDecimal sumSentToOthers(@Param("organizationId") UUID organizationId,
                               @Param("userId") UUID userId,
                               @Param("statuses") Collection<AllocationStatus> statuses);

    @Query("""
        SELECT COUNT(a) FROM FundAllocationEntity a
        WHERE a.organizationId = :organizationId AND a.fromUserId = :userId
          AND a.toUserId <> :userId AND a.status IN :statuses
        """)
    long countSentToOthers(@Param("organizationId") UUID organizationId,
                           @Param("userId") UUID userId,
                           @Param("statuses") Collection<AllocationStatus> statuses);
}
