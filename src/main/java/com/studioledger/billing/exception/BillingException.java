package com.studioledger.billing.exception;

/**
 * Root of every business failure raised by the ledger. Unchecked, so a failing write rolls back
 * the surrounding transaction.
 */
public abstract class BillingException extends RuntimeException {

    protected BillingException(String message) {
        super(message);
    }

    protected BillingException(String message, Throwable cause) {
        super(message, cause);
    }
}
