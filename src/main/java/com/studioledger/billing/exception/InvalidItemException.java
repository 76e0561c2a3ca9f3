package com.studioledger.billing.exception;

/** A line item failed validation. */
public class InvalidItemException extends ValidationException {

    public InvalidItemException(String message) {
        super(message);
    }
}
