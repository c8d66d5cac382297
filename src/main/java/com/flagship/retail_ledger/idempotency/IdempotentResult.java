package com.flagship.retail_ledger.idempotency;

import lombok.Value;

/**
 * Outcome of an idempotent command: the stored result, and whether it came from an earlier
 * request with the same key.
 */
@Value
public class IdempotentResult<T> {
    T value;
    boolean replayed;

    public static <T> IdempotentResult<T> created(T value) {
        return new IdempotentResult<>(value, false);
    }

    public static <T> IdempotentResult<T> replayed(T value) {
        return new IdempotentResult<>(value, true);
    }
}
