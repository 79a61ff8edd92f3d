package com.hold.application.service;

import com.hold.domain.DomainException;

/**
 * A control operation was refused. The message is final and meant for the caller.
 */
public abstract class HoldInvoiceException extends DomainException {

    protected HoldInvoiceException(String message) {
        super(message);
    }

    /** Stable machine-readable reason. */
    public abstract String reason();
}
