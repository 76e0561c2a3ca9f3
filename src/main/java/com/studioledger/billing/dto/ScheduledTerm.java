package com.studioledger.billing.dto;

import com.studioledger.billing.model.Money;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ScheduledTerm(int termNumber, BigDecimal percentage, Money amount, LocalDate dueDate,
        String description) {
}
