package com.studioledger.billing.dto;

import com.studioledger.billing.model.DiscountType;

import java.math.BigDecimal;

public record Discount(DiscountType type, BigDecimal value) {

    public static Discount fixed(BigDecimal value) {
        return new Discount(DiscountType.FIXED, value);
    }

    public static Discount percentage(BigDecimal value) {
        return new Discount(DiscountType.PERCENTAGE, value);
    }
}
