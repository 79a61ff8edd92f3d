package com.hold.application.ports;

public class InvoiceStoreException extends RuntimeException {

    public InvoiceStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
