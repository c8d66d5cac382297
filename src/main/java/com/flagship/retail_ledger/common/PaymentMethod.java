package com.flagship.retail_ledger.common;

public enum PaymentMethod {
    CASH,
    MOMO,
    BANK
}
