package com.studioledger.billing.dto;

import com.studioledger.billing.model.InvoiceStatus;
import com.studioledger.billing.model.PaymentMethod;
import com.studioledger.billing.model.TermStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record InvoiceDetails(
        Long id,
        String invoiceNumber,
        Long clientId,
        Long projectId,
        LocalDate invoiceDate,
        LocalDate dueDate,
        InvoiceStatus status,
        BigDecimal taxRate,
        BigDecimal subtotal,
        BigDecimal discountAmount,
        BigDecimal taxAmount,
        BigDecimal totalAmount,
        BigDecimal paidAmount,
        BigDecimal remainingAmount,
        BigDecimal paymentPercentage,
        String notes,
        List<Item> items,
        List<Term> terms,
        List<PaymentEntry> payments,
        List<CreditNoteEntry> creditNotes) {

    public record Item(Integer lineNumber, String description, BigDecimal quantity, BigDecimal unitPrice,
            BigDecimal taxRate, BigDecimal lineTotal) {
    }

    public record Term(Long id, Integer termNumber, BigDecimal percentage, BigDecimal amount, LocalDate dueDate,
            String description, TermStatus status, BigDecimal paidAmount, BigDecimal remainingAmount) {
    }

    /** A receipt, or a negative counter-entry when {@code refundOfId} is set. */
    public record PaymentEntry(Long id, Long termId, BigDecimal amount, LocalDate paymentDate, PaymentMethod method,
            String referenceNumber, Long refundOfId, String refundReason) {
    }

    public record CreditNoteEntry(Long id, String noteNumber, BigDecimal amount, String reason, LocalDate noteDate,
            Long refundPaymentId) {
    }
}
