package com.studioledger.billing.repository;

import com.studioledger.billing.model.Invoice;
import com.studioledger.billing.model.InvoiceStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

public interface InvoiceRepository extends JpaRepository<Invoice, Long> {
    /**
     * Row lock for ledger writes. Force-increment also bumps the version so any stale copy held
     * elsewhere fails its next flush.
     */
    @Lock(LockModeType.PESSIMISTIC_FORCE_INCREMENT)
    @QueryHints({ @QueryHint(name = "jakarta.persistence.lock.timeout", value = "10000") })
    @Query("SELECT i FROM Invoice i WHERE i.id = :id")
    Optional<Invoice> findByIdForUpdate(@Param("id") Long id);

    Optional<Invoice> findTopByInvoiceNumberStartingWithOrderByInvoiceNumberDesc(String prefix);

    @Query("SELECT COALESCE(SUM(i.totalAmount), 0) FROM Invoice i WHERE i.status = :status")
    BigDecimal sumTotalByStatus(@Param("status") InvoiceStatus status);

    @Query("SELECT COALESCE(SUM(i.totalAmount), 0) FROM Invoice i WHERE i.status <> :status")
    BigDecimal sumTotalByStatusNot(@Param("status") InvoiceStatus status);

    long countByStatusAndDueDateBefore(InvoiceStatus status, LocalDate date);
}
