package com.flagship.retail_ledger.balance;

import com.flagship.retail_ledger.catalog.CounterpartyKind;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of an administrative absolute balance set.
 */
@Value
public class BalanceOverride {
    UUID id;
    String tenantId;
    CounterpartyKind kind;
    UUID counterpartyId;
    BigDecimal previousBalance;
    BigDecimal newBalance;
    String reason;
    String userId;
    Instant createdAt;
}
