package com.flagship.retail_ledger.purchase;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PurchaseRepository extends JpaRepository<PurchaseEntity, UUID> {

    Optional<PurchaseEntity> findByIdAndTenantId(UUID id, String tenantId);
}
