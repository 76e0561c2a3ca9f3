package com.studioledger.billing.model;

import java.util.EnumSet;
import java.util.Set;

public enum InvoiceStatus {
    DRAFT,
    SENT,
    PAID,
    // Never persisted; reported for sent invoices past their due date.
    OVERDUE,
    CANCELLED;

    public Set<InvoiceStatus> nextStates() {
        switch (this) {
            case DRAFT:
                return EnumSet.of(SENT, CANCELLED);
            case SENT:
            case OVERDUE:
                return EnumSet.of(PAID, OVERDUE, CANCELLED);
            case PAID:
                // refunds reopen a paid invoice
                return EnumSet.of(SENT);
            default:
                return EnumSet.noneOf(InvoiceStatus.class);
        }
    }

    public boolean canTransitionTo(InvoiceStatus target) {
        return nextStates().contains(target);
    }
}
