package com.studioledger.billing.exception;

public class ResourceNotFoundException extends BillingException {

    public ResourceNotFoundException(String resource, Long id) {
        super(resource + " " + id + " not found");
    }
}
