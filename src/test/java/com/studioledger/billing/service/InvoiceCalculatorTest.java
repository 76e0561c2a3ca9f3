package com.studioledger.billing.service;

import com.studioledger.billing.dto.Discount;
import com.studioledger.billing.dto.InvoiceTotals;
import com.studioledger.billing.dto.LineItemRequest;
import com.studioledger.billing.exception.InvalidDiscountException;
import com.studioledger.billing.exception.InvalidItemException;
import com.studioledger.billing.exception.ValidationException;
import com.studioledger.billing.model.Money;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class InvoiceCalculatorTest {

    private final InvoiceCalculator calculator = new InvoiceCalculator();

    private static LineItemRequest item(String qty, String price) {
        return new LineItemRequest("Design work", new BigDecimal(qty), new BigDecimal(price));
    }

    @Test
    void calculate_ShouldApplyInvoiceTaxRate() {
        InvoiceTotals totals = calculator.calculate(List.of(item("2", "100"), item("1", "50")),
                new BigDecimal("10"), null);

        assertEquals(Money.of("250.00"), totals.subtotal());
        assertEquals(Money.ZERO, totals.discountAmount());
        assertEquals(Money.of("25.00"), totals.taxAmount());
        assertEquals(Money.of("275.00"), totals.totalAmount());
        assertEquals(List.of(Money.of("200"), Money.of("50")), totals.lineTotals());
    }

    @Test
    void calculate_ShouldTaxDiscountedBase() {
        // 10% off 250 = 25, tax 10% of 225 = 22.50
        InvoiceTotals totals = calculator.calculate(List.of(item("2", "100"), item("1", "50")),
                new BigDecimal("10"), Discount.percentage(new BigDecimal("10")));

        assertEquals(Money.of("25.00"), totals.discountAmount());
        assertEquals(Money.of("22.50"), totals.taxAmount());
        assertEquals(Money.of("247.50"), totals.totalAmount());
    }

    @Test
    void calculate_ShouldPreferItemTaxRate() {
        List<LineItemRequest> items = List.of(
                new LineItemRequest("Hosting", BigDecimal.ONE, new BigDecimal("100"), BigDecimal.ZERO),
                new LineItemRequest("Consulting", BigDecimal.ONE, new BigDecimal("100"), null));

        InvoiceTotals totals = calculator.calculate(items, new BigDecimal("20"), null);

        assertEquals(Money.of("20.00"), totals.taxAmount());
        assertEquals(Money.of("220.00"), totals.totalAmount());
    }

    @Test
    void calculate_ShouldRoundEachLine() {
        // 3 x 0.335 = 1.005 -> 1.01 per line
        InvoiceTotals totals = calculator.calculate(List.of(item("3", "0.335"), item("3", "0.335")),
                BigDecimal.ZERO, null);

        assertEquals(Money.of("2.02"), totals.subtotal());
    }

    @Test
    void calculate_ShouldAllowFixedDiscountUpToSubtotal() {
        InvoiceTotals totals = calculator.calculate(List.of(item("1", "80")), new BigDecimal("10"),
                Discount.fixed(new BigDecimal("80")));

        assertEquals(Money.ZERO, totals.taxAmount());
        assertEquals(Money.ZERO, totals.totalAmount());
    }

    @Test
    void calculate_ShouldRejectBadItems() {
        assertThrows(InvalidItemException.class,
                () -> calculator.calculate(List.of(item("0", "10")), BigDecimal.ZERO, null));
        assertThrows(InvalidItemException.class,
                () -> calculator.calculate(List.of(item("1", "-0.01")), BigDecimal.ZERO, null));
        assertThrows(InvalidItemException.class, () -> calculator.calculate(
                List.of(new LineItemRequest(" ", BigDecimal.ONE, BigDecimal.TEN)), BigDecimal.ZERO, null));
        assertThrows(InvalidItemException.class, () -> calculator.calculate(
                List.of(new LineItemRequest("x", BigDecimal.ONE, BigDecimal.TEN, new BigDecimal("101"))),
                BigDecimal.ZERO, null));
    }

    @Test
    void calculate_ShouldRejectBadDiscounts() {
        List<LineItemRequest> items = List.of(item("1", "100"));
        assertThrows(InvalidDiscountException.class,
                () -> calculator.calculate(items, BigDecimal.ZERO, Discount.percentage(new BigDecimal("100.01"))));
        assertThrows(InvalidDiscountException.class,
                () -> calculator.calculate(items, BigDecimal.ZERO, Discount.fixed(new BigDecimal("-1"))));
        assertThrows(InvalidDiscountException.class,
                () -> calculator.calculate(items, BigDecimal.ZERO, Discount.fixed(new BigDecimal("100.01"))));
    }

    @Test
    void calculate_ShouldRejectTaxRateOutOfRange() {
        assertThrows(ValidationException.class,
                () -> calculator.calculate(List.of(item("1", "1")), new BigDecimal("-1"), null));
        assertThrows(ValidationException.class,
                () -> calculator.calculate(List.of(item("1", "1")), new BigDecimal("100.5"), null));
    }

    @Test
    void calculate_ShouldBeIdempotent() {
        List<LineItemRequest> items = List.of(item("1.5", "33.33"), item("7", "0.99"));
        Discount discount = Discount.percentage(new BigDecimal("12.5"));

        assertEquals(calculator.calculate(items, new BigDecimal("7.25"), discount),
                calculator.calculate(items, new BigDecimal("7.25"), discount));
    }

    @Test
    void calculate_TotalIdentityHoldsForRandomInvoices() {
        Random random = new Random(42);
        for (int run = 0; run < 500; run++) {
            List<LineItemRequest> items = new ArrayList<>();
            int count = 1 + random.nextInt(6);
            for (int i = 0; i < count; i++) {
                BigDecimal qty = BigDecimal.valueOf(1 + random.nextInt(1000), 2);
                BigDecimal price = BigDecimal.valueOf(random.nextInt(100000), 2);
                BigDecimal rate = random.nextBoolean() ? BigDecimal.valueOf(random.nextInt(2500), 2) : null;
                items.add(new LineItemRequest("Line " + i, qty, price, rate));
            }
            BigDecimal taxRate = BigDecimal.valueOf(random.nextInt(3000), 2);
            Discount discount = random.nextBoolean()
                    ? Discount.percentage(BigDecimal.valueOf(random.nextInt(10001), 2))
                    : null;

            InvoiceTotals totals = calculator.calculate(items, taxRate, discount);

            assertEquals(totals.subtotal().plus(totals.taxAmount()).minus(totals.discountAmount()),
                    totals.totalAmount(), "run " + run);
            assertFalse(totals.totalAmount().isNegative(), "run " + run);
            assertFalse(totals.taxAmount().isNegative(), "run " + run);
        }
    }
}
