package com.flagship.retail_ledger.exception;

/**
 * Failure kinds surfaced by the ledger engine.
 *
 * Only {@link #CONCURRENCY_CONFLICT} is safe to retry unchanged. Every other kind
 * means the request itself is invalid or would break a business invariant.
 */
public enum ErrorKind {
    INSUFFICIENT_STOCK,
    INVALID_UNIT_INPUT,
    TIER_UNAVAILABLE,
    RETURN_EXCEEDS_ORIGINAL,
    OVERPAYMENT_NOT_ALLOWED,
    NEGATIVE_BALANCE_GUARD,
    VALIDATION_ERROR,
    CONCURRENCY_CONFLICT,
    NOT_FOUND;

    public boolean isRetryable() {
        return this == CONCURRENCY_CONFLICT;
    }
}
