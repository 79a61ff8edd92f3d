package com.hold.application.service;

public class InvoiceNotFoundException extends HoldInvoiceException {

    public InvoiceNotFoundException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "invoice_not_found";
    }
}
