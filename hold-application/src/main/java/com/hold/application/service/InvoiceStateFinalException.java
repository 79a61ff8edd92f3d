package com.hold.application.service;

public class InvoiceStateFinalException extends HoldInvoiceException {

    public InvoiceStateFinalException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "state_final";
    }
}
