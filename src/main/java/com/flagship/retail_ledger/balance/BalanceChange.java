package com.flagship.retail_ledger.balance;

import com.flagship.retail_ledger.catalog.CounterpartyKind;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class BalanceChange {
    CounterpartyKind kind;
    UUID counterpartyId;
    BigDecimal previousBalance;
    BigDecimal newBalance;

    public BigDecimal getDelta() {
        return newBalance.subtract(previousBalance);
    }
}
