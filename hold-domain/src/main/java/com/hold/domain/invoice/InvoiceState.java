package com.hold.domain.invoice;

import java.util.Locale;

public enum InvoiceState {
    UNPAID,
    ACCEPTED,
    PAID,
    CANCELLED;

    public boolean isFinal() {
        return this == PAID || this == CANCELLED;
    }

    public boolean canTransitionTo(InvoiceState next) {
        return switch (this) {
            case UNPAID -> next == ACCEPTED || next == CANCELLED;
            case ACCEPTED -> next == PAID || next == CANCELLED;
            case PAID, CANCELLED -> false;
        };
    }

    /** Lowercase name as it appears in client-facing messages. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static InvoiceState parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("invoice state is blank");
        }
        return InvoiceState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
