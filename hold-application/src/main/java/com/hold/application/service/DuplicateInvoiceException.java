package com.hold.application.service;

public class DuplicateInvoiceException extends HoldInvoiceException {

    public DuplicateInvoiceException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "duplicate_invoice";
    }
}
