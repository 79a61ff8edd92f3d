package com.hold.domain.invoice;

import com.hold.domain.DomainException;

public class InvalidInvoiceTransitionException extends DomainException {

    private final InvoiceState from;

    public InvalidInvoiceTransitionException(InvoiceState from, String message) {
        super(message);
        this.from = from;
    }

    public InvoiceState from() {
        return from;
    }
}
