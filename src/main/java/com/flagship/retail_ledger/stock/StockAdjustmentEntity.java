package com.flagship.retail_ledger.stock;

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
@Table(name = "stock_adjustments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StockAdjustmentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "item_id", nullable = false, updatable = false)
    private UUID itemId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private AdjustmentType type;

    @Column(nullable = false, updatable = false, precision = 19, scale = 6)
    private BigDecimal quantity;

    @Column(name = "previous_quantity", nullable = false, updatable = false, precision = 19, scale = 6)
    private BigDecimal previousQuantity;

    @Column(name = "new_quantity", nullable = false, updatable = false, precision = 19, scale = 6)
    private BigDecimal newQuantity;

    @Column(nullable = false, updatable = false, length = 500)
    private String reason;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static StockAdjustmentEntity fromDomain(StockAdjustment adjustment, String idempotencyKey) {
        return new StockAdjustmentEntity(
            adjustment.getId(),
            adjustment.getTenantId(),
            adjustment.getItemId(),
            adjustment.getType(),
            adjustment.getQuantity(),
            adjustment.getPreviousQuantity(),
            adjustment.getNewQuantity(),
            adjustment.getReason(),
            adjustment.getUserId(),
            idempotencyKey,
            null
        );
    }

    public StockAdjustment toDomain() {
        return new StockAdjustment(id, tenantId, itemId, type, quantity, previousQuantity, newQuantity,
            reason, userId, createdAt);
    }
}
