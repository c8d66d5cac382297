package com.flagship.retail_ledger.exception;

public class InvalidUnitInputException extends LedgerException {

    public InvalidUnitInputException(String message) {
        super(ErrorKind.INVALID_UNIT_INPUT, message);
    }
}
