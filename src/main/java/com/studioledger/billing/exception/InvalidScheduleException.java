package com.studioledger.billing.exception;

/** A payment term schedule that does not cover the invoice total exactly. */
public class InvalidScheduleException extends ValidationException {

    public InvalidScheduleException(String message) {
        super(message);
    }
}
