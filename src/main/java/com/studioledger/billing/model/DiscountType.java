package com.studioledger.billing.model;

public enum DiscountType {
    FIXED, PERCENTAGE
}
