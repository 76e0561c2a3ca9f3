package com.studioledger.billing.model;

public enum PaymentMethod {
    CASH, BANK_TRANSFER, CARD, CHECK, OTHER
}
