package com.flagship.retail_ledger.sale;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SaleRepository extends JpaRepository<SaleEntity, UUID> {

    Optional<SaleEntity> findByIdAndTenantId(UUID id, String tenantId);
}
