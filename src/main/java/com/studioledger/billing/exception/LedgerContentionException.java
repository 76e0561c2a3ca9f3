package com.studioledger.billing.exception;

/** Retries on a contended invoice ran out. Safe for the caller to retry later. */
public class LedgerContentionException extends BillingException {

    public LedgerContentionException(Long invoiceId, int attempts, Throwable cause) {
        super("Invoice " + invoiceId + " is busy, gave up after " + attempts + " attempts", cause);
    }
}
