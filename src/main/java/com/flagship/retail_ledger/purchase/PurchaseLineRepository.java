package com.flagship.retail_ledger.purchase;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PurchaseLineRepository extends JpaRepository<PurchaseLineEntity, UUID> {

    List<PurchaseLineEntity> findByPurchaseIdAndTenantIdOrderByLineNumberAsc(UUID purchaseId, String tenantId);

    List<PurchaseLineEntity> findByPurchaseIdAndTenantIdAndItemId(UUID purchaseId, String tenantId, UUID itemId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM PurchaseLineEntity l WHERE l.id = :id AND l.purchaseId = :purchaseId AND l.tenantId = :tenantId")
    Optional<PurchaseLineEntity> findForUpdate(@Param("id") UUID id,
                                               @Param("purchaseId") UUID purchaseId,
                                               @Param("tenantId") String tenantId);
}
