package com.hold.application.ports;

/**
 * @param paymentSecret hex of the {@code s} field the encoder generated
 */
public record EncodedInvoice(String bolt11, String paymentSecret) {}
