package com.studioledger.billing.dto;

import com.studioledger.billing.model.InvoiceStatus;

import java.math.BigDecimal;

public record RefundResult(
        Long refundPaymentId,
        Long originalPaymentId,
        Long creditNoteId,
        String creditNoteNumber,
        BigDecimal amount,
        Long invoiceId,
        InvoiceStatus invoiceStatus,
        BigDecimal remainingBalance) {
}
