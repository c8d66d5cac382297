package com.flagship.retail_ledger.purchase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "purchase_lines")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PurchaseLineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "purchase_id", nullable = false, updatable = false)
    private UUID purchaseId;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "item_id", nullable = false, updatable = false)
    private UUID itemId;

    @Column(name = "line_number", nullable = false, updatable = false)
    private int lineNumber;

    @Column(nullable = false, updatable = false, precision = 19, scale = 6)
    private BigDecimal quantity;

    @Column(name = "unit_cost", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal unitCost;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal subtotal;

    static PurchaseLineEntity fromDomain(PurchaseLine line, String tenantId) {
        return new PurchaseLineEntity(
            line.getId(),
            line.getPurchaseId(),
            tenantId,
            line.getItemId(),
            line.getLineNumber(),
            line.getQuantity(),
            line.getUnitCost(),
            line.getSubtotal()
        );
    }

    public PurchaseLine toDomain() {
        return new PurchaseLine(id, purchaseId, itemId, lineNumber, quantity, unitCost, subtotal);
    }
}
