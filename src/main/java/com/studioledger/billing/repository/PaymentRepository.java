package com.studioledger.billing.repository;

import com.studioledger.billing.model.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface PaymentRepository extends JpaRepository<Payment, Long> {
    List<Payment> findByInvoiceIdOrderByPaymentDateAscIdAsc(Long invoiceId);

    @Query("SELECT p.invoice.id FROM Payment p WHERE p.id = :paymentId")
    Optional<Long> findInvoiceIdById(@Param("paymentId") Long paymentId);

    // Net of refunds: counter-entries are negative.
    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM Payment p WHERE p.invoice.id = :invoiceId")
    BigDecimal sumByInvoiceId(@Param("invoiceId") Long invoiceId);

    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM Payment p WHERE p.term.id = :termId")
    BigDecimal sumByTermId(@Param("termId") Long termId);

    /** Sum of the counter-entries reversing one payment; zero or negative. */
    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM Payment p WHERE p.refundOf.id = :paymentId")
    BigDecimal sumByRefundOfId(@Param("paymentId") Long paymentId);

    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM Payment p WHERE p.paymentDate BETWEEN :from AND :to")
    BigDecimal sumBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);

    // Receipts only; refund counter-entries are left out. [method, count, total]
    @Query("SELECT p.paymentMethod, COUNT(p), SUM(p.amount) FROM Payment p WHERE p.refundOf IS NULL "
            + "AND p.paymentDate BETWEEN :from AND :to GROUP BY p.paymentMethod ORDER BY SUM(p.amount) DESC")
    List<Object[]> sumReceiptsByMethodBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);
}
