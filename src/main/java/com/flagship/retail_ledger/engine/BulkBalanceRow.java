package com.flagship.retail_ledger.engine;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class BulkBalanceRow {
    UUID counterpartyId;
    BigDecimal balance;
    String reason;
}
