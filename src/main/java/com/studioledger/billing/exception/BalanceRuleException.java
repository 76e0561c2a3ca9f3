package com.studioledger.billing.exception;

import java.math.BigDecimal;

/**
 * A write refused because it would break a balance rule. Carries the balance the caller may still
 * use so it can retry with a corrected amount.
 */
public abstract class BalanceRuleException extends BillingException {

    private final BigDecimal remainingBalance;

    protected BalanceRuleException(String message, BigDecimal remainingBalance) {
        super(message);
        this.remainingBalance = remainingBalance;
    }

    public BigDecimal getRemainingBalance() {
        return remainingBalance;
    }
}
