package com.flagship.retail_ledger.sale;

import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.common.PaymentType;
import com.flagship.retail_ledger.pricing.DiscountType;
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
import java.util.List;
import java.util.UUID;

/**
 * Sale header row. Append-only: every column is non-updatable.
 */
@Entity
@Table(name = "sales")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SaleEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "customer_id", updatable = false)
    private UUID customerId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal subtotal;

    @Enumerated(EnumType.STRING)
    @Column(name = "discount_type", updatable = false, length = 10)
    private DiscountType discountType;

    @Column(name = "discount_value", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal discountValue;

    @Column(name = "order_discount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal orderDiscount;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal totalAmount;

    @Column(name = "paid_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal paidAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type", nullable = false, updatable = false, length = 10)
    private PaymentType paymentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, updatable = false, length = 10)
    private PaymentMethod paymentMethod;

    @Column(name = "created_by", nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static SaleEntity fromDomain(Sale sale) {
        return new SaleEntity(
            sale.getId(),
            sale.getTenantId(),
            sale.getCustomerId(),
            sale.getSubtotal(),
            sale.getDiscountType(),
            sale.getDiscountValue(),
            sale.getOrderDiscount(),
            sale.getTotalAmount(),
            sale.getPaidAmount(),
            sale.getPaymentType(),
            sale.getPaymentMethod(),
            sale.getCreatedBy(),
            null  // set by @PrePersist
        );
    }

    Sale toDomain(List<SaleLine> lines) {
        return new Sale(
            id,
            tenantId,
            customerId,
            List.copyOf(lines),
            subtotal,
            discountType,
            discountValue,
            orderDiscount,
            totalAmount,
            paidAmount,
            paymentType,
            paymentMethod,
            createdBy,
            createdAt
        );
    }
}
