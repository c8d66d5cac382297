package com.flagship.retail_ledger.balance;

public enum BalanceEntryType {
    CREDIT_SALE,
    CREDIT_PURCHASE,
    PAYMENT,
    RETURN_CREDIT
}
