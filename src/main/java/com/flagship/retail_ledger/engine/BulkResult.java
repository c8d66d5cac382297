package com.flagship.retail_ledger.engine;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a bulk request. Rows fail independently; each failed row is counted as skipped and
 * described in {@code errors} as {@code "Row N: ..."} (1-based).
 */
@Value
public class BulkResult {
    int updated;
    int skipped;
    List<String> errors;
}
