package com.flagship.fund_ledger.consumption;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface BillRepository extends JpaRepository<BillEntity, UUID> {

    Optional<BillEntity> findByIdAndOrganizationId(UUID id, UUID organizationId);
}
