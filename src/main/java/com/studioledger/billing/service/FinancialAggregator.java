package com.studioledger.billing.service;

import com.studioledger.billing.dto.DateRange;
import com.studioledger.billing.dto.FinancialSummary;
import com.studioledger.billing.dto.MonthlyFigure;
import com.studioledger.billing.dto.PaymentMethodFigure;
import com.studioledger.billing.model.InvoiceStatus;
import com.studioledger.billing.model.Money;
import com.studioledger.billing.model.PaymentMethod;
import com.studioledger.billing.model.TransactionType;
import com.studioledger.billing.repository.FinanceTransactionRepository;
import com.studioledger.billing.repository.InvoiceRepository;
import com.studioledger.billing.repository.PaymentRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Dashboard figures derived from committed finance postings, payments and invoices. Takes no locks
 * and writes nothing.
 */
@Service
@Transactional(readOnly = true)
public class FinancialAggregator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final FinanceTransactionRepository transactionRepository;
    private final InvoiceRepository invoiceRepository;
    private final PaymentRepository paymentRepository;
    private final Clock clock;

    public FinancialAggregator(FinanceTransactionRepository transactionRepository,
            InvoiceRepository invoiceRepository, PaymentRepository paymentRepository, Clock clock) {
        this.transactionRepository = transactionRepository;
        this.invoiceRepository = invoiceRepository;
        this.paymentRepository = paymentRepository;
        this.clock = clock;
    }

    public FinancialSummary getFinancialSummary(DateRange range) {
        Money income = Money.of(transactionRepository.sumByTypeBetween(TransactionType.INCOME, range.from(), range.to()));
        Money expenses = Money.of(transactionRepository.sumByTypeBetween(TransactionType.EXPENSE, range.from(), range.to()));
        Money profit = income.minus(expenses);

        Money totalIncome = Money.of(transactionRepository.sumByType(TransactionType.INCOME));
        Money totalExpenses = Money.of(transactionRepository.sumByType(TransactionType.EXPENSE));
        Money paymentsReceived = Money.of(paymentRepository.sumBetween(range.from(), range.to()));

        Money outstanding = Money.of(invoiceRepository.sumTotalByStatus(InvoiceStatus.SENT));
        Money invoiceValue = Money.of(invoiceRepository.sumTotalByStatusNot(InvoiceStatus.CANCELLED));
        Money paidValue = Money.of(invoiceRepository.sumTotalByStatus(InvoiceStatus.PAID));
        long overdue = invoiceRepository.countByStatusAndDueDateBefore(InvoiceStatus.SENT, LocalDate.now(clock));

        List<MonthlyFigure> trend = monthlyTrend(range);
        BigDecimal incomeGrowth = BigDecimal.ZERO.setScale(Money.SCALE);
        BigDecimal expenseGrowth = BigDecimal.ZERO.setScale(Money.SCALE);
        if (trend.size() >= 2) {
            MonthlyFigure first = trend.get(0);
            MonthlyFigure last = trend.get(trend.size() - 1);
            incomeGrowth = growthRate(first.income(), last.income());
            expenseGrowth = growthRate(first.expenses(), last.expenses());
        }

        return new FinancialSummary(range, income.toBigDecimal(), expenses.toBigDecimal(), profit.toBigDecimal(),
                profit.percentOf(income), totalIncome.toBigDecimal(), totalExpenses.toBigDecimal(),
                paymentsReceived.toBigDecimal(), outstanding.toBigDecimal(), invoiceValue.toBigDecimal(),
                paidValue.toBigDecimal(), paidValue.percentOf(invoiceValue), overdue, trend, incomeGrowth,
                expenseGrowth, paymentsByMethod(range));
    }

    /**
     * Count, total and average of the payments received per method in the range, largest total first.
     */
    public List<PaymentMethodFigure> paymentsByMethod(DateRange range) {
        List<PaymentMethodFigure> figures = new ArrayList<>();
        for (Object[] row : paymentRepository.sumReceiptsByMethodBetween(range.from(), range.to())) {
            long count = ((Number) row[1]).longValue();
            Money total = Money.of((BigDecimal) row[2]);
            BigDecimal average = total.toBigDecimal().divide(BigDecimal.valueOf(count), Money.SCALE, RoundingMode.HALF_UP);
            figures.add(new PaymentMethodFigure((PaymentMethod) row[0], count, total.toBigDecimal(), average));
        }
        return figures;
    }

    /**
     * Months that have at least one posting, oldest first.
     */
    public List<MonthlyFigure> monthlyTrend(DateRange range) {
        Map<YearMonth, BigDecimal[]> buckets = new TreeMap<>();
        for (Object[] row : transactionRepository.sumByMonthAndType(range.from(), range.to())) {
            YearMonth month = YearMonth.of(((Number) row[0]).intValue(), ((Number) row[1]).intValue());
            TransactionType type = (TransactionType) row[2];
            BigDecimal amount = (BigDecimal) row[3];
            BigDecimal[] bucket = buckets.computeIfAbsent(month, m -> new BigDecimal[] { BigDecimal.ZERO, BigDecimal.ZERO });
            int slot = type == TransactionType.INCOME ? 0 : 1;
            bucket[slot] = bucket[slot].add(amount);
        }

        List<MonthlyFigure> trend = new ArrayList<>(buckets.size());
        buckets.forEach((month, bucket) -> {
            Money in = Money.of(bucket[0]);
            Money out = Money.of(bucket[1]);
            trend.add(new MonthlyFigure(month, in.toBigDecimal(), out.toBigDecimal(), in.minus(out).toBigDecimal()));
        });
        return trend;
    }

    /** Percent change from first to last; 100 when growing from nothing, 0 when flat at nothing. */
    static BigDecimal growthRate(BigDecimal first, BigDecimal last) {
        if (first.signum() == 0) {
            return (last.signum() > 0 ? HUNDRED : BigDecimal.ZERO).setScale(Money.SCALE);
        }
        return last.subtract(first).multiply(HUNDRED).divide(first, Money.SCALE, RoundingMode.HALF_UP);
    }
}
