package com.studioledger.billing.model;

public enum TransactionType {
    INCOME, EXPENSE
}
