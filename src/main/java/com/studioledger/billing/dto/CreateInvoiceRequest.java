package com.studioledger.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * {@code invoiceDate} defaults to today and {@code dueDate} to the configured number of payment
 * days after it.
 */
public record CreateInvoiceRequest(
        Long clientId,
        Long projectId,
        LocalDate invoiceDate,
        LocalDate dueDate,
        List<LineItemRequest> items,
        BigDecimal taxRate,
        Discount discount,
        String notes) {
}
