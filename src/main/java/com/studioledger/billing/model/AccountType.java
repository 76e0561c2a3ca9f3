package com.studioledger.billing.model;

public enum AccountType {
    ASSET, LIABILITY, INCOME, EXPENSE, EQUITY
}
