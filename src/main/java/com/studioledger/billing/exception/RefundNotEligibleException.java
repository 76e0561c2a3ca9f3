package com.studioledger.billing.exception;

import java.math.BigDecimal;

public class RefundNotEligibleException extends BalanceRuleException {

    public RefundNotEligibleException(String message, BigDecimal refundableBalance) {
        super(message, refundableBalance);
    }
}
