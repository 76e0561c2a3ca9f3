package com.studioledger.billing.dto;

import java.math.BigDecimal;
import java.util.List;

public record FinancialSummary(
        DateRange range,
        BigDecimal income,
        BigDecimal expenses,
        BigDecimal profit,
        BigDecimal profitMargin,
        BigDecimal totalIncome,
        BigDecimal totalExpenses,
        BigDecimal paymentsReceived,
        BigDecimal outstandingAmount,
        BigDecimal totalInvoiceValue,
        BigDecimal paidInvoiceValue,
        BigDecimal collectionRate,
        long overdueInvoiceCount,
        List<MonthlyFigure> trend,
        BigDecimal incomeGrowth,
        BigDecimal expenseGrowth,
        List<PaymentMethodFigure> paymentsByMethod) {
}
