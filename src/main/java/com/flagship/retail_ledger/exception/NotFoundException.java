package com.flagship.retail_ledger.exception;

import java.util.Map;

/**
 * The referenced row does not exist or belongs to another tenant. Both cases look the same
 * to the caller.
 */
public class NotFoundException extends LedgerException {

    public NotFoundException(String entity, Object id) {
        super(ErrorKind.NOT_FOUND, entity + " not found: " + id,
            Map.of("entity", entity, "id", id));
    }
}
