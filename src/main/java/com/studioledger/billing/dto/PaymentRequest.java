package com.studioledger.billing.dto;

import com.studioledger.billing.model.PaymentMethod;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PaymentRequest(
        BigDecimal amount,
        Long termId,
        PaymentMethod method,
        String referenceNumber,
        LocalDate paymentDate,
        String notes) {
}
