package com.flagship.retail_ledger.returns;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Repository
public interface SupplierReturnRepository extends JpaRepository<SupplierReturnEntity, UUID> {

    @Query("SELECT COALESCE(SUM(r.quantity), 0) FROM SupplierReturnEntity r WHERE r.purchaseLineId = :lineId")
    BigDecimal sumQuantityByPurchaseLineId(@Param("lineId") UUID purchaseLineId);

    List<SupplierReturnEntity> findByPurchaseIdAndTenantIdOrderByCreatedAtAsc(UUID purchaseId, String tenantId);
}
