package com.studioledger.billing.repository;

import com.studioledger.billing.model.FinanceTransaction;
import com.studioledger.billing.model.TransactionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public interface FinanceTransactionRepository extends JpaRepository<FinanceTransaction, Long> {
    List<FinanceTransaction> findByPaymentId(Long paymentId);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM FinanceTransaction t WHERE t.type = :type")
    BigDecimal sumByType(@Param("type") TransactionType type);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM FinanceTransaction t WHERE t.type = :type "
            + "AND t.transactionDate BETWEEN :from AND :to")
    BigDecimal sumByTypeBetween(@Param("type") TransactionType type, @Param("from") LocalDate from,
            @Param("to") LocalDate to);

    @Query("SELECT YEAR(t.transactionDate), MONTH(t.transactionDate), t.type, SUM(t.amount) "
            + "FROM FinanceTransaction t WHERE t.transactionDate BETWEEN :from AND :to "
            + "GROUP BY YEAR(t.transactionDate), MONTH(t.transactionDate), t.type")
    List<Object[]> sumByMonthAndType(@Param("from") LocalDate from, @Param("to") LocalDate to); // [year, month, type, total]
}
