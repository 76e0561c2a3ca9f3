package com.studioledger.billing.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "invoices")
@Data
public class Invoice {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, length = 32)
    private String invoiceNumber;

    @Column(nullable = false)
    private Long clientId;

    private Long projectId;

    @Column(nullable = false)
    private LocalDate invoiceDate;

    @Column(nullable = false)
    private LocalDate dueDate;

    @OneToMany(mappedBy = "invoice", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber ASC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<InvoiceItem> items = new ArrayList<>();

    @OneToMany(mappedBy = "invoice", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("termNumber ASC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<InvoiceTerm> terms = new ArrayList<>();

    @Column(precision = 5, scale = 2, nullable = false)
    private BigDecimal taxRate = BigDecimal.ZERO;

    @Enumerated(EnumType.STRING)
    private DiscountType discountType;

    @Column(precision = 15, scale = 2)
    private BigDecimal discountValue;

    @Column(precision = 15, scale = 2, nullable = false)
    private BigDecimal subtotal;

    @Column(precision = 15, scale = 2, nullable = false)
    private BigDecimal discountAmount;

    @Column(precision = 15, scale = 2, nullable = false)
    private BigDecimal taxAmount;

    @Column(precision = 15, scale = 2, nullable = false)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private InvoiceStatus status;

    @Column(length = 2000)
    private String notes;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @Version
    private Long version;

    public void addItem(InvoiceItem item) {
        item.setInvoice(this);
        items.add(item);
    }

    public void addTerm(InvoiceTerm term) {
        term.setInvoice(this);
        terms.add(term);
    }

    public Money total() {
        return Money.ofNullable(totalAmount);
    }

    /**
     * Status as reported to callers. A sent invoice past its due date reads as overdue
     * until it is paid or cancelled.
     */
    public InvoiceStatus effectiveStatus(LocalDate today) {
        if (status == InvoiceStatus.SENT && dueDate != null && dueDate.isBefore(today)) {
            return InvoiceStatus.OVERDUE;
        }
        return status;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (status == null)
            status = InvoiceStatus.DRAFT;
        if (taxRate == null)
            taxRate = BigDecimal.ZERO;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
