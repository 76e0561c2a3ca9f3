package com.studioledger.billing.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, BigDecimal remainingBalance) {

    public ErrorResponse(String error, String message) {
        this(error, message, null);
    }
}
