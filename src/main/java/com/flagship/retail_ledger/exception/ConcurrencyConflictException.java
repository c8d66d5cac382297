package com.flagship.retail_ledger.exception;

import java.util.Map;

/**
 * Lock contention, deadlock or optimistic version clash. The whole operation may be resubmitted.
 */
public class ConcurrencyConflictException extends LedgerException {

    public ConcurrencyConflictException(String operation, Throwable cause) {
        super(ErrorKind.CONCURRENCY_CONFLICT,
            "Concurrent modification while executing " + operation + "; retry the operation",
            Map.of("operation", operation), cause);
    }
}
