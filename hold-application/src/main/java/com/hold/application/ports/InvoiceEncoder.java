package com.hold.application.ports;

/**
 * Builds and signs bolt11 invoices with the node key.
 */
public interface InvoiceEncoder {

    EncodedInvoice encode(InvoiceRequest request);

    /** Compressed public key of the signing node, hex. */
    String nodeId();
}
