package com.studioledger.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record RefundRequest(BigDecimal amount, String reason, LocalDate refundDate) {
}
