package com.flagship.retail_ledger.pricing;

public enum DiscountType {
    PERCENT,
    AMOUNT
}
