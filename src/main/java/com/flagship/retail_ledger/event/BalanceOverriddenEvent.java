package com.flagship.retail_ledger.event;

import com.flagship.retail_ledger.balance.BalanceOverride;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class BalanceOverriddenEvent implements LedgerEvent {
    UUID eventId;
    String tenantId;
    UUID overrideId;
    String counterpartyKind;
    UUID counterpartyId;
    BigDecimal previousBalance;
    BigDecimal newBalance;
    String userId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BalanceOverridden";
    public static final String AGGREGATE_TYPE = "Counterparty";

    @Override
    public UUID getAggregateId() {
        return counterpartyId;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static BalanceOverriddenEvent fromOverride(BalanceOverride override) {
        return new BalanceOverriddenEvent(
            UUID.randomUUID(),
            override.getTenantId(),
            override.getId(),
            override.getKind().name(),
            override.getCounterpartyId(),
            override.getPreviousBalance(),
            override.getNewBalance(),
            override.getUserId(),
            Instant.now()
        );
    }
}
