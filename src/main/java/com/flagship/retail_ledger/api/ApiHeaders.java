package com.flagship.retail_ledger.api;

/**
 * Headers set by the upstream tenant gate. Both are trusted as-is.
 */
public final class ApiHeaders {

    public static final String TENANT_ID = "X-Tenant-ID";
    public static final String USER_ID = "X-User-ID";
    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private ApiHeaders() {
    }
}
