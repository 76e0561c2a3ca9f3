package com.studioledger.billing.repository;

import com.studioledger.billing.model.CreditNote;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CreditNoteRepository extends JpaRepository<CreditNote, Long> {
    List<CreditNote> findByInvoiceIdOrderByNoteDateAsc(Long invoiceId);

    Optional<CreditNote> findTopByNoteNumberStartingWithOrderByNoteNumberDesc(String prefix);
}
