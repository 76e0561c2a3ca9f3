package com.studioledger.billing.dto;

import com.studioledger.billing.model.Money;

import java.util.List;

public record InvoiceTotals(List<Money> lineTotals, Money subtotal, Money discountAmount, Money taxAmount,
        Money totalAmount) {
}
