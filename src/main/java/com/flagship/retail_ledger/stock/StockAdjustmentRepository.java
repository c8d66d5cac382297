package com.flagship.retail_ledger.stock;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StockAdjustmentRepository extends JpaRepository<StockAdjustmentEntity, UUID> {

    Optional<StockAdjustmentEntity> findByTenantIdAndIdempotencyKey(String tenantId, String idempotencyKey);

    Optional<StockAdjustmentEntity> findByIdAndTenantId(UUID id, String tenantId);

    List<StockAdjustmentEntity> findByTenantIdAndItemIdOrderByCreatedAtAsc(String tenantId, UUID itemId);
}
