package com.studioledger.billing.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(name = "invoice_terms", uniqueConstraints = @UniqueConstraint(columnNames = { "invoice_id", "termNumber" }))
@Data
public class InvoiceTerm {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "invoice_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Invoice invoice;

    @Column(nullable = false)
    private Integer termNumber;

    @Column(precision = 5, scale = 2, nullable = false)
    private BigDecimal percentage;

    @Column(precision = 15, scale = 2, nullable = false)
    private BigDecimal amount;

    @Column(nullable = false)
    private LocalDate dueDate;

    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TermStatus status;

    public TermStatus effectiveStatus(LocalDate today) {
        if (status == TermStatus.PENDING && dueDate != null && dueDate.isBefore(today)) {
            return TermStatus.OVERDUE;
        }
        return status;
    }

    @PrePersist
    protected void onCreate() {
        if (status == null)
            status = TermStatus.PENDING;
    }
}
