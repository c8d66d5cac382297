package com.flagship.retail_ledger.exception;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

public class NegativeBalanceGuardException extends LedgerException {

    private final BigDecimal currentBalance;
    private final BigDecimal delta;

    public NegativeBalanceGuardException(UUID counterpartyId, BigDecimal currentBalance, BigDecimal delta) {
        super(ErrorKind.NEGATIVE_BALANCE_GUARD,
            String.format("Applying %s to balance %s would drop below zero",
                delta.toPlainString(), currentBalance.toPlainString()),
            Map.of("counterparty_id", counterpartyId,
                "balance", currentBalance.toPlainString(),
                "delta", delta.toPlainString()));
        this.currentBalance = currentBalance;
        this.delta = delta;
    }

    public BigDecimal getCurrentBalance() {
        return currentBalance;
    }

    public BigDecimal getDelta() {
        return delta;
    }
}
