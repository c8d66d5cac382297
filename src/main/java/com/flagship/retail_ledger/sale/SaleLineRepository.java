package com.flagship.retail_ledger.sale;

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
public interface SaleLineRepository extends JpaRepository<SaleLineEntity, UUID> {

    List<SaleLineEntity> findBySaleIdAndTenantIdOrderByLineNumberAsc(UUID saleId, String tenantId);

    List<SaleLineEntity> findBySaleIdAndTenantIdAndItemId(UUID saleId, String tenantId, UUID itemId);

    /**
     * Locks the line for the duration of a return, so concurrent returns against it serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM SaleLineEntity l WHERE l.id = :id AND l.saleId = :saleId AND l.tenantId = :tenantId")
    Optional<SaleLineEntity> findForUpdate(@Param("id") UUID id,
                                           @Param("saleId") UUID saleId,
                                           @Param("tenantId") String tenantId);
}
