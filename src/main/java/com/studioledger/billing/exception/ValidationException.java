package com.studioledger.billing.exception;

/** Malformed or out-of-range input. Never retried. */
public class ValidationException extends BillingException {

    public ValidationException(String message) {
        super(message);
    }
}
