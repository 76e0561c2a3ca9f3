package com.studioledger.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/** Changes to a draft invoice. Null fields are left as they are. */
public record InvoicePatch(
        LocalDate invoiceDate,
        LocalDate dueDate,
        List<LineItemRequest> items,
        BigDecimal taxRate,
        Discount discount,
        String notes) {
}
