package com.flagship.retail_ledger.common;

/**
 * How a sale or purchase is settled at the time it is recorded.
 * CASH is paid in full; CREDIT leaves the unpaid remainder on the counterparty balance.
 */
public enum PaymentType {
    CASH,
    CREDIT
}
