package com.studioledger.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record TermRequest(Integer termNumber, BigDecimal percentage, LocalDate dueDate, String description) {
}
