package com.hold.application.ports;

public interface InvoiceDecoder {

    /**
     * @throws IllegalArgumentException when the string is not a valid, correctly signed invoice
     */
    DecodedInvoice decode(String bolt11);
}
