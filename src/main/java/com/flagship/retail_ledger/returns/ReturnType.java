package com.flagship.retail_ledger.returns;

/**
 * How a return is settled.
 * CASH refunds over the counter, CREDIT reduces the counterparty balance, and EXCHANGE swaps goods
 * without touching the balance.
 */
public enum ReturnType {
    CASH,
    CREDIT,
    EXCHANGE
}
