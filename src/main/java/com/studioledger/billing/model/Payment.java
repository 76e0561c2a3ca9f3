package com.studioledger.billing.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One row of the append-only payment history. Refunds are stored as negative counter-entries
 * pointing back at the payment they reverse through {@link #refundOf}.
 */
@Entity
@Table(name = "payments", indexes = {
        @Index(name = "idx_payments_invoice", columnList = "invoice_id"),
        @Index(name = "idx_payments_refund_of", columnList = "refund_of_id")
})
@Data
public class Payment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "invoice_id", nullable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Invoice invoice;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "term_id", updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private InvoiceTerm term;

    @Column(precision = 15, scale = 2, nullable = false, updatable = false)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false)
    private LocalDate paymentDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private PaymentMethod paymentMethod;

    @Column(updatable = false)
    private String referenceNumber; // e.g. cheque number, transfer id

    @Column(length = 1000, updatable = false)
    private String notes;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "refund_of_id", updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Payment refundOf;

    @Column(updatable = false)
    private String refundReason;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    public boolean isRefund() {
        return refundOf != null;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (paymentDate == null)
            paymentDate = LocalDate.now();
    }
}
