package com.flagship.retail_ledger.payment;

import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.common.PaymentMethod;
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

/**
 * Payment row. Exactly one of {@code customerId} and {@code supplierId} is set.
 *
 * The idempotency key is a persistence concern and is passed to {@link #fromDomain} separately
 * from the domain object.
 */
@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "customer_id", updatable = false)
    private UUID customerId;

    @Column(name = "supplier_id", updatable = false)
    private UUID supplierId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private PaymentMethod method;

    @Column(updatable = false)
    private String reference;

    @Column(name = "idempotency_key", updatable = false)
    private String idempotencyKey;

    @Column(name = "created_by", nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static PaymentEntity fromDomain(Payment payment, String idempotencyKey) {
        boolean customer = payment.getKind() == CounterpartyKind.CUSTOMER;
        return new PaymentEntity(
            payment.getId(),
            payment.getTenantId(),
            customer ? payment.getCounterpartyId() : null,
            customer ? null : payment.getCounterpartyId(),
            payment.getAmount(),
            payment.getMethod(),
            payment.getReference(),
            idempotencyKey,
            payment.getCreatedBy(),
            null
        );
    }

    public Payment toDomain() {
        CounterpartyKind kind = customerId != null ? CounterpartyKind.CUSTOMER : CounterpartyKind.SUPPLIER;
        return new Payment(
            id,
            tenantId,
            kind,
            customerId != null ? customerId : supplierId,
            amount,
            method,
            reference,
            createdBy,
            createdAt
        );
    }
}
