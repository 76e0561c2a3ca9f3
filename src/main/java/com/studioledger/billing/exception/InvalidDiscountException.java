package com.studioledger.billing.exception;

/** The discount is negative, over 100 percent, or larger than the subtotal. */
public class InvalidDiscountException extends ValidationException {

    public InvalidDiscountException(String message) {
        super(message);
    }
}
