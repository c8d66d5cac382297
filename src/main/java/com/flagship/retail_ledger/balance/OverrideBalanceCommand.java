package com.flagship.retail_ledger.balance;

import com.flagship.retail_ledger.catalog.CounterpartyKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class OverrideBalanceCommand {
    String tenantId;
    String userId;
    CounterpartyKind kind;
    UUID counterpartyId;
    BigDecimal newBalance;
    String reason;
}
