package com.studioledger.billing.service;

import com.studioledger.billing.dto.DateRange;
import com.studioledger.billing.dto.FinancialSummary;
import com.studioledger.billing.dto.MonthlyFigure;
import com.studioledger.billing.dto.PaymentMethodFigure;
import com.studioledger.billing.exception.ValidationException;
import com.studioledger.billing.model.InvoiceStatus;
import com.studioledger.billing.model.PaymentMethod;
import com.studioledger.billing.model.TransactionType;
import com.studioledger.billing.repository.FinanceTransactionRepository;
import com.studioledger.billing.repository.InvoiceRepository;
import com.studioledger.billing.repository.PaymentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FinancialAggregatorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 4, 15);
    private static final DateRange Q1 = new DateRange(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 3, 31));

    @Mock
    private FinanceTransactionRepository transactionRepository;
    @Mock
    private InvoiceRepository invoiceRepository;
    @Mock
    private PaymentRepository paymentRepository;

    private FinancialAggregator aggregator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        aggregator = new FinancialAggregator(transactionRepository, invoiceRepository, paymentRepository, clock);
    }

    private void givenLedger() {
        when(transactionRepository.sumByTypeBetween(TransactionType.INCOME, Q1.from(), Q1.to()))
                .thenReturn(new BigDecimal("4000.00"));
        when(transactionRepository.sumByTypeBetween(TransactionType.EXPENSE, Q1.from(), Q1.to()))
                .thenReturn(new BigDecimal("1000.00"));
        when(transactionRepository.sumByType(TransactionType.INCOME)).thenReturn(new BigDecimal("9000.00"));
        when(transactionRepository.sumByType(TransactionType.EXPENSE)).thenReturn(new BigDecimal("1500.00"));
        when(paymentRepository.sumBetween(Q1.from(), Q1.to())).thenReturn(new BigDecimal("3000.00"));
        when(invoiceRepository.sumTotalByStatus(InvoiceStatus.SENT)).thenReturn(new BigDecimal("2500.00"));
        when(invoiceRepository.sumTotalByStatus(InvoiceStatus.PAID)).thenReturn(new BigDecimal("7500.00"));
        when(invoiceRepository.sumTotalByStatusNot(InvoiceStatus.CANCELLED)).thenReturn(new BigDecimal("10000.00"));
        when(invoiceRepository.countByStatusAndDueDateBefore(InvoiceStatus.SENT, TODAY)).thenReturn(2L);
        when(transactionRepository.sumByMonthAndType(Q1.from(), Q1.to())).thenReturn(List.of(
                new Object[] { 2026, 3, TransactionType.INCOME, new BigDecimal("1500.00") },
                new Object[] { 2026, 1, TransactionType.INCOME, new BigDecimal("1000.00") },
                new Object[] { 2026, 1, TransactionType.EXPENSE, new BigDecimal("400.00") },
                new Object[] { 2026, 2, TransactionType.INCOME, new BigDecimal("1500.00") },
                new Object[] { 2026, 3, TransactionType.EXPENSE, new BigDecimal("600.00") }));
    }

    @Test
    void getFinancialSummary_ShouldComputeDashboardFigures() {
        givenLedger();

        FinancialSummary summary = aggregator.getFinancialSummary(Q1);

        assertEquals(new BigDecimal("4000.00"), summary.income());
        assertEquals(new BigDecimal("3000.00"), summary.profit());
        assertEquals(new BigDecimal("75.00"), summary.profitMargin());
        assertEquals(new BigDecimal("7500.00"), summary.totalIncome().subtract(summary.totalExpenses()));
        assertEquals(new BigDecimal("3000.00"), summary.paymentsReceived());
        assertEquals(new BigDecimal("2500.00"), summary.outstandingAmount());
        assertEquals(new BigDecimal("75.00"), summary.collectionRate());
        assertEquals(2L, summary.overdueInvoiceCount());
    }

    @Test
    void getFinancialSummary_ShouldBucketTrendByMonth() {
        givenLedger();

        List<MonthlyFigure> trend = aggregator.getFinancialSummary(Q1).trend();

        assertEquals(List.of(YearMonth.of(2026, 1), YearMonth.of(2026, 2), YearMonth.of(2026, 3)),
                trend.stream().map(MonthlyFigure::month).toList());
        assertEquals(new BigDecimal("600.00"), trend.get(0).profit());
        assertEquals(new BigDecimal("0.00"), trend.get(1).expenses());
        assertEquals(new BigDecimal("900.00"), trend.get(2).profit());
    }

    @Test
    void getFinancialSummary_ShouldComputeGrowthFromFirstAndLastMonth() {
        givenLedger();

        FinancialSummary summary = aggregator.getFinancialSummary(Q1);

        assertEquals(new BigDecimal("50.00"), summary.incomeGrowth());
        assertEquals(new BigDecimal("50.00"), summary.expenseGrowth());
    }

    @Test
    void getFinancialSummary_ShouldBeIdempotent() {
        givenLedger();

        assertEquals(aggregator.getFinancialSummary(Q1), aggregator.getFinancialSummary(Q1));
    }

    @Test
    void getFinancialSummary_ShouldReturnZeroRatesForEmptyLedger() {
        DateRange march = DateRange.of(YearMonth.of(2026, 3));
        when(transactionRepository.sumByTypeBetween(any(), any(), any())).thenReturn(BigDecimal.ZERO);
        when(transactionRepository.sumByType(any())).thenReturn(BigDecimal.ZERO);
        when(paymentRepository.sumBetween(any(), any())).thenReturn(BigDecimal.ZERO);
        when(invoiceRepository.sumTotalByStatus(any())).thenReturn(BigDecimal.ZERO);
        when(invoiceRepository.sumTotalByStatusNot(any())).thenReturn(BigDecimal.ZERO);
        when(transactionRepository.sumByMonthAndType(march.from(), march.to())).thenReturn(List.of());

        FinancialSummary summary = aggregator.getFinancialSummary(march);

        assertEquals(new BigDecimal("0.00"), summary.profitMargin());
        assertEquals(new BigDecimal("0.00"), summary.collectionRate());
        assertEquals(new BigDecimal("0.00"), summary.incomeGrowth());
        assertTrue(summary.trend().isEmpty());
    }

    @Test
    void getFinancialSummary_ShouldBreakPaymentsDownByMethod() {
        givenLedger();
        when(paymentRepository.sumReceiptsByMethodBetween(Q1.from(), Q1.to())).thenReturn(List.of(
                new Object[] { PaymentMethod.BANK_TRANSFER, 3L, new BigDecimal("2500.00") },
                new Object[] { PaymentMethod.CASH, 2L, new BigDecimal("500.01") }));

        List<PaymentMethodFigure> byMethod = aggregator.getFinancialSummary(Q1).paymentsByMethod();

        assertEquals(2, byMethod.size());
        assertEquals(new PaymentMethodFigure(PaymentMethod.BANK_TRANSFER, 3, new BigDecimal("2500.00"),
                new BigDecimal("833.33")), byMethod.get(0));
        assertEquals(new BigDecimal("250.01"), byMethod.get(1).average());
    }

    @Test
    void paymentsByMethod_ShouldBeEmptyWithoutReceipts() {
        assertTrue(aggregator.paymentsByMethod(Q1).isEmpty());
    }

    @Test
    void growthRate_ShouldHandleZeroBaseline() {
        assertEquals(new BigDecimal("100.00"), FinancialAggregator.growthRate(BigDecimal.ZERO, BigDecimal.ONE));
        assertEquals(new BigDecimal("0.00"), FinancialAggregator.growthRate(BigDecimal.ZERO, BigDecimal.ZERO));
        assertEquals(new BigDecimal("-25.00"),
                FinancialAggregator.growthRate(new BigDecimal("200"), new BigDecimal("150")));
    }

    @Test
    void dateRange_ShouldRejectReversedBounds() {
        assertThrows(ValidationException.class,
                () -> new DateRange(LocalDate.of(2026, 2, 1), LocalDate.of(2026, 1, 1)));
    }
}
