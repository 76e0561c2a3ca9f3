package com.studioledger.billing.exception;

import com.studioledger.billing.model.InvoiceStatus;

public class InvalidTransitionException extends BillingException {

    private final InvoiceStatus currentStatus;

    public InvalidTransitionException(InvoiceStatus currentStatus, String message) {
        super(message);
        this.currentStatus = currentStatus;
    }

    public InvoiceStatus getCurrentStatus() {
        return currentStatus;
    }
}
