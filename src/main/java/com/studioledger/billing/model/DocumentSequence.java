package com.studioledger.billing.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One row per document type. Number generation locks the row, so numbers of one type are handed out
 * one transaction at a time.
 */
@Entity
@Table(name = "document_sequences")
@Data
@NoArgsConstructor
public class DocumentSequence {
    @Id
    @Column(length = 16)
    private String documentType; // the number prefix, e.g. INV

    @Column(length = 32)
    private String lastNumber;

    private LocalDateTime updatedAt;

    public DocumentSequence(String documentType) {
        this.documentType = documentType;
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }
}
