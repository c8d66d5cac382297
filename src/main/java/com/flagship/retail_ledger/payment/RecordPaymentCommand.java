package com.flagship.retail_ledger.payment;

import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.common.PaymentMethod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class RecordPaymentCommand {
    String tenantId;
    String userId;
    CounterpartyKind kind;
    UUID counterpartyId;
    BigDecimal amount;
    PaymentMethod method;
    String reference;
    String idempotencyKey;    // optional
}
