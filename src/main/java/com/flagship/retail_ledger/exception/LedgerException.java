package com.flagship.retail_ledger.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every failure the engine reports to its callers.
 *
 * Unchecked so that it crosses {@code @Transactional} boundaries and triggers rollback.
 * The {@link ErrorKind} is what callers switch on; the details map carries the values
 * needed to explain the failure (available stock, remaining returnable quantity, ...).
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, String> details;

    protected LedgerException(ErrorKind kind, String message) {
        this(kind, message, Map.of(), null);
    }

    protected LedgerException(ErrorKind kind, String message, Map<String, ?> details) {
        this(kind, message, details, null);
    }

    protected LedgerException(ErrorKind kind, String message, Map<String, ?> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        Map<String, String> copy = new LinkedHashMap<>();
        details.forEach((key, value) -> copy.put(key, String.valueOf(value)));
        this.details = Collections.unmodifiableMap(copy);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, String> getDetails() {
        return details;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
