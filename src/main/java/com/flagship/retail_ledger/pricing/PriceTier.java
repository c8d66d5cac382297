package com.flagship.retail_ledger.pricing;

/**
 * Price a sale line is charged at. {@link #DEFAULT} is the item's selling price and always exists.
 */
public enum PriceTier {
    DEFAULT,
    RETAIL,
    WHOLESALE,
    PROMO
}
