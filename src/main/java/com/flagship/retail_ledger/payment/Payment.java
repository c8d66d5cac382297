package com.flagship.retail_ledger.payment;

import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.common.PaymentMethod;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Money received from a customer or paid to a supplier against their outstanding balance.
 */
@Value
public class Payment {
    UUID id;
    String tenantId;
    CounterpartyKind kind;
    UUID counterpartyId;
    BigDecimal amount;
    PaymentMethod method;
    String reference;
    String createdBy;
    Instant createdAt;
}
