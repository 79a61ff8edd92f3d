package com.hold.application.service;

import com.hold.application.ports.RoutingHint;
import com.hold.domain.invoice.PaymentHash;
import com.hold.domain.invoice.Preimage;

import java.util.List;

/**
 * Request to issue a new hold invoice. Either {@code paymentHash} or {@code preimage}
 * must be present; when both are, they must match.
 *
 * Null optional fields fall back to the configured defaults.
 */
public record CreateInvoiceCommand(
        PaymentHash paymentHash,
        Preimage preimage,
        Long amountMsat,
        String memo,
        String descriptionHash,
        Long expirySeconds,
        Integer minFinalCltvExpiry,
        List<RoutingHint> routingHints
) {
    public static CreateInvoiceCommand of(PaymentHash paymentHash, Long amountMsat, String memo) {
        return new CreateInvoiceCommand(paymentHash, null, amountMsat, memo, null, null, null, List.of());
    }

    public PaymentHash resolvedPaymentHash() {
        if (paymentHash == null && preimage == null) {
            throw new InvalidInvoiceException("payment hash or preimage is required");
        }
        if (preimage == null) return paymentHash;
        PaymentHash derived = preimage.paymentHash();
        if (paymentHash != null && !paymentHash.equals(derived)) {
            throw new InvalidInvoiceException("preimage does not match payment hash");
        }
        return derived;
    }
}
