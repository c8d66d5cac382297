package com.flagship.retail_ledger.returns;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "customer_returns")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CustomerReturnEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "sale_id", nullable = false, updatable = false)
    private UUID saleId;

    @Column(name = "sale_line_id", nullable = false, updatable = false)
    private UUID saleLineId;

    @Column(name = "item_id", nullable = false, updatable = false)
    private UUID itemId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 6)
    private BigDecimal quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private ReturnType type;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(updatable = false, length = 500)
    private String reason;

    @Column(name = "created_by", nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static CustomerReturnEntity fromDomain(CustomerReturn customerReturn) {
        return new CustomerReturnEntity(
            customerReturn.getId(),
            customerReturn.getTenantId(),
            customerReturn.getSaleId(),
            customerReturn.getSaleLineId(),
            customerReturn.getItemId(),
            customerReturn.getQuantity(),
            customerReturn.getType(),
            customerReturn.getAmount(),
            customerReturn.getReason(),
            customerReturn.getCreatedBy(),
            null
        );
    }

    public CustomerReturn toDomain() {
        return new CustomerReturn(id, tenantId, saleId, saleLineId, itemId, quantity, type, amount,
            reason, createdBy, createdAt);
    }
}
