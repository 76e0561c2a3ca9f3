package com.studioledger.billing.exception;

import java.math.BigDecimal;

public class OverpaymentRejectedException extends BalanceRuleException {

    public OverpaymentRejectedException(BigDecimal attempted, BigDecimal remainingBalance) {
        super("Payment of " + attempted.toPlainString() + " exceeds remaining balance of "
                + remainingBalance.toPlainString(), remainingBalance);
    }
}
