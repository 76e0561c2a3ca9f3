package com.studioledger.billing.dto;

import java.math.BigDecimal;
import java.time.YearMonth;

public record MonthlyFigure(YearMonth month, BigDecimal income, BigDecimal expenses, BigDecimal profit) {
}
