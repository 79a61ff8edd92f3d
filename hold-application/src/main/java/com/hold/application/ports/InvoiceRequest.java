package com.hold.application.ports;

import com.hold.domain.invoice.PaymentHash;

import java.util.List;
import java.util.Objects;

/**
 * Fields our node signs into a new bolt11 invoice.
 */
public record InvoiceRequest(
        PaymentHash paymentHash,
        Long amountMsat,
        String memo,
        String descriptionHash,
        long expirySeconds,
        int minFinalCltvExpiry,
        List<RoutingHint> routingHints
) {
    public InvoiceRequest {
        Objects.requireNonNull(paymentHash, "paymentHash");
        routingHints = routingHints == null ? List.of() : List.copyOf(routingHints);
    }
}
