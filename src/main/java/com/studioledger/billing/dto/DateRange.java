package com.studioledger.billing.dto;

import com.studioledger.billing.exception.ValidationException;

import java.time.LocalDate;
import java.time.YearMonth;

/** Inclusive on both ends. */
public record DateRange(LocalDate from, LocalDate to) {

    public DateRange {
        if (from == null || to == null) {
            throw new ValidationException("Date range needs both a start and an end");
        }
        if (to.isBefore(from)) {
            throw new ValidationException("Date range ends before it starts");
        }
    }

    public static DateRange of(YearMonth month) {
        return new DateRange(month.atDay(1), month.atEndOfMonth());
    }
}
