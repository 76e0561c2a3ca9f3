package com.studioledger.billing.model;

public enum TermStatus {
    PENDING, PAID, OVERDUE
}
