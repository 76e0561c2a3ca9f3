package com.studioledger.billing.dto;

import com.studioledger.billing.model.PaymentMethod;

import java.math.BigDecimal;

public record PaymentMethodFigure(PaymentMethod method, long count, BigDecimal total, BigDecimal average) {
}
