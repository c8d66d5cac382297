package com.flagship.retail_ledger.balance;

import com.flagship.retail_ledger.catalog.CounterpartyKind;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Stored balance compared with the sum of its journal. A non-zero drift is expected only when
 * an override was applied.
 */
@Value
public class BalanceReconciliation {
    CounterpartyKind kind;
    UUID counterpartyId;
    BigDecimal balance;
    BigDecimal journalSum;
    BigDecimal drift;
    boolean overridden;

    public boolean isConsistent() {
        return drift.signum() == 0;
    }
}
