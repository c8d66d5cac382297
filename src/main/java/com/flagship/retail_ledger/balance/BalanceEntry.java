package com.flagship.retail_ledger.balance;

import com.flagship.retail_ledger.catalog.CounterpartyKind;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One row of the append-only balance journal.
 */
@Value
public class BalanceEntry {
    UUID id;
    String tenantId;
    CounterpartyKind kind;
    UUID counterpartyId;
    BalanceEntryType entryType;
    UUID sourceId;
    BigDecimal delta;
    BigDecimal resultingBalance;
    long sequenceNumber;
    Instant createdAt;
}
