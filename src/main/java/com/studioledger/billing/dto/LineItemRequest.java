package com.studioledger.billing.dto;

import java.math.BigDecimal;

/** One priced line as supplied by the caller. {@code taxRate} may be null to inherit the invoice rate. */
public record LineItemRequest(String description, BigDecimal quantity, BigDecimal unitPrice, BigDecimal taxRate) {

    public LineItemRequest(String description, BigDecimal quantity, BigDecimal unitPrice) {
        this(description, quantity, unitPrice, null);
    }
}
