package com.flagship.retail_ledger.returns;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Repository
public interface CustomerReturnRepository extends JpaRepository<CustomerReturnEntity, UUID> {

    @Query("SELECT COALESCE(SUM(r.quantity), 0) FROM CustomerReturnEntity r WHERE r.saleLineId = :lineId")
    BigDecimal sumQuantityBySaleLineId(@Param("lineId") UUID saleLineId);

    List<CustomerReturnEntity> findBySaleIdAndTenantIdOrderByCreatedAtAsc(UUID saleId, String tenantId);
}
