package com.studioledger.billing.dto;

import com.studioledger.billing.model.InvoiceStatus;
import com.studioledger.billing.model.TermStatus;

import java.math.BigDecimal;

public record PaymentReceipt(
        Long paymentId,
        Long invoiceId,
        Long termId,
        BigDecimal amount,
        BigDecimal paidAmount,
        BigDecimal remainingAmount,
        InvoiceStatus invoiceStatus,
        TermStatus termStatus) {
}
