package com.flagship.retail_ledger.sale;

import com.flagship.retail_ledger.pricing.PriceTier;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "sale_lines")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SaleLineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "sale_id", nullable = false, updatable = false)
    private UUID saleId;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "item_id", nullable = false, updatable = false)
    private UUID itemId;

    @Column(name = "line_number", nullable = false, updatable = false)
    private int lineNumber;

    @Column(nullable = false, updatable = false, precision = 19, scale = 6)
    private BigDecimal quantity;

    @Column(name = "unit_price", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal unitPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "price_tier", nullable = false, updatable = false, length = 16)
    private PriceTier priceTier;

    @Column(name = "line_discount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal lineDiscount;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal subtotal;

    static SaleLineEntity fromDomain(SaleLine line, String tenantId) {
        return new SaleLineEntity(
            line.getId(),
            line.getSaleId(),
            tenantId,
            line.getItemId(),
            line.getLineNumber(),
            line.getQuantity(),
            line.getUnitPrice(),
            line.getPriceTier(),
            line.getLineDiscount(),
            line.getSubtotal()
        );
    }

    public SaleLine toDomain() {
        return new SaleLine(id, saleId, itemId, lineNumber, quantity, unitPrice, priceTier, lineDiscount, subtotal);
    }
}
