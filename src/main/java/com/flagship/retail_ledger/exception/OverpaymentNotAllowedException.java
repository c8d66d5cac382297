package com.flagship.retail_ledger.exception;

import java.math.BigDecimal;
import java.util.Map;

public class OverpaymentNotAllowedException extends LedgerException {

    public OverpaymentNotAllowedException(BigDecimal balance, BigDecimal amount) {
        super(ErrorKind.OVERPAYMENT_NOT_ALLOWED,
            "Payment amount exceeds outstanding balance",
            Map.of("balance", balance.toPlainString(), "payment_amount", amount.toPlainString()));
    }
}
