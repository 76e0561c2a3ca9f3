package com.studioledger.billing.service;

import com.studioledger.billing.dto.Discount;
import com.studioledger.billing.dto.InvoiceTotals;
import com.studioledger.billing.dto.LineItemRequest;
import com.studioledger.billing.exception.InvalidDiscountException;
import com.studioledger.billing.exception.InvalidItemException;
import com.studioledger.billing.exception.ValidationException;
import com.studioledger.billing.model.DiscountType;
import com.studioledger.billing.model.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns priced line items into invoice totals.
 * <p>
 * Line totals are rounded one by one. The discount comes off the subtotal before tax, and each
 * line's tax is charged on its share of the discounted subtotal at the line's own rate, falling
 * back to the invoice rate. Tax is rounded once, after summing.
 */
@Component
public class InvoiceCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public InvoiceTotals calculate(List<LineItemRequest> items, BigDecimal taxRate, Discount discount) {
        BigDecimal invoiceRate = taxRate == null ? BigDecimal.ZERO : taxRate;
        if (!isRate(invoiceRate)) {
            throw new ValidationException("Tax rate must be between 0 and 100, got " + invoiceRate.toPlainString());
        }

        List<Money> lineTotals = new ArrayList<>(items.size());
        Money subtotal = Money.ZERO;
        // Σ line_total × rate, kept exact until the final rounding
        BigDecimal weightedTax = BigDecimal.ZERO;

        for (int i = 0; i < items.size(); i++) {
            LineItemRequest item = items.get(i);
            validateItem(i + 1, item);

            Money lineTotal = Money.of(item.quantity().multiply(item.unitPrice()));
            lineTotals.add(lineTotal);
            subtotal = subtotal.plus(lineTotal);

            BigDecimal rate = item.taxRate() != null ? item.taxRate() : invoiceRate;
            weightedTax = weightedTax.add(lineTotal.toBigDecimal().multiply(rate));
        }

        Money discountAmount = discountAmount(subtotal, discount);
        Money taxableBase = subtotal.minus(discountAmount);

        Money taxAmount = Money.ZERO;
        if (subtotal.isPositive()) {
            taxAmount = Money.of(weightedTax.multiply(taxableBase.toBigDecimal())
                    .divide(subtotal.toBigDecimal().multiply(HUNDRED), Money.SCALE, RoundingMode.HALF_UP));
        }

        Money total = subtotal.minus(discountAmount).plus(taxAmount).max(Money.ZERO);
        return new InvoiceTotals(List.copyOf(lineTotals), subtotal, discountAmount, taxAmount, total);
    }

    private void validateItem(int line, LineItemRequest item) {
        if (item == null) {
            throw new InvalidItemException("Line " + line + " is missing");
        }
        if (item.description() == null || item.description().isBlank()) {
            throw new InvalidItemException("Line " + line + ": description is required");
        }
        if (item.quantity() == null || item.quantity().signum() <= 0) {
            throw new InvalidItemException("Line " + line + ": quantity must be greater than zero");
        }
        if (item.unitPrice() == null || item.unitPrice().signum() < 0) {
            throw new InvalidItemException("Line " + line + ": unit price must not be negative");
        }
        if (item.taxRate() != null && !isRate(item.taxRate())) {
            throw new InvalidItemException("Line " + line + ": tax rate must be between 0 and 100");
        }
    }

    private Money discountAmount(Money subtotal, Discount discount) {
        if (discount == null || discount.type() == null || discount.value() == null) {
            return Money.ZERO;
        }
        BigDecimal value = discount.value();
        if (value.signum() < 0) {
            throw new InvalidDiscountException("Discount must not be negative");
        }
        if (discount.type() == DiscountType.PERCENTAGE) {
            if (value.compareTo(HUNDRED) > 0) {
                throw new InvalidDiscountException("Percentage discount cannot exceed 100");
            }
            return subtotal.percent(value);
        }
        Money fixed = Money.of(value);
        if (fixed.isGreaterThan(subtotal)) {
            throw new InvalidDiscountException("Fixed discount of " + fixed + " exceeds subtotal of " + subtotal);
        }
        return fixed;
    }

    private static boolean isRate(BigDecimal rate) {
        return rate.signum() >= 0 && rate.compareTo(HUNDRED) <= 0;
    }
}
