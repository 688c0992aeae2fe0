package com.flagship.fund_ledger.contract;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContractRepository extends JpaRepository<ContractEntity, UUID> {

    Optional<ContractEntity> findByIdAndOrganizationId(UUID id, UUID organizationId);

    /**
     * Serializes payments against one contract so two installment payments
     * cannot both read the same paid amount.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ContractEntity c WHERE c.id = :id AND c.organizationId = :organizationId")
    Optional<ContractEntity> findByIdForUpdate(@Param("id") UUID id, @Param("organizationId") UUID organizationId);
}
