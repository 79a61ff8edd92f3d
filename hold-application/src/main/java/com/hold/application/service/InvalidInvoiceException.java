package com.hold.application.service;

public class InvalidInvoiceException extends HoldInvoiceException {

    public InvalidInvoiceException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "invalid_invoice";
    }
}
