package com.flagship.retail_ledger.exception;

public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
