package com.flagship.retail_ledger.balance;

/**
 * Whether a balance delta may leave the balance below zero.
 */
public enum FloorPolicy {
    /** A decrease that would leave the balance negative is rejected. */
    ENFORCE_FLOOR,
    /** Negative balances are allowed (credit notes owed back to the counterparty). */
    ALLOW_NEGATIVE
}
