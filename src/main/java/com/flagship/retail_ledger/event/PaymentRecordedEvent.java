package com.flagship.retail_ledger.event;

import com.flagship.retail_ledger.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PaymentRecordedEvent implements LedgerEvent {
    UUID eventId;
    String tenantId;
    UUID paymentId;
    String counterpartyKind;
    UUID counterpartyId;
    BigDecimal amount;
    String method;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentRecorded";

    @Override
    public UUID getAggregateId() {
        return counterpartyId;
    }

    @Override
    public String getAggregateType() {
        return BalanceOverriddenEvent.AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentRecordedEvent fromPayment(Payment payment) {
        return new PaymentRecordedEvent(
            UUID.randomUUID(),
            payment.getTenantId(),
            payment.getId(),
            payment.getKind().name(),
            payment.getCounterpartyId(),
            payment.getAmount(),
            payment.getMethod().name(),
            Instant.now()
        );
    }
}
