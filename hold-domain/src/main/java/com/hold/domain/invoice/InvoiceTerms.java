package com.hold.domain.invoice;

import java.util.Objects;

/**
 * Immutable terms an invoice was issued with. Either taken from our own encoder
 * or parsed out of an injected bolt11 string.
 *
 * @param preimage      known up front only when the caller handed it over at creation
 * @param amountMsat    null for "any amount" invoices
 * @param paymentSecret hex, null when the invoice carries none
 * @param minCltv       optional override of {@code minFinalCltvExpiry} for injected invoices
 */
public record InvoiceTerms(
        PaymentHash paymentHash,
        Preimage preimage,
        String bolt11,
        Long amountMsat,
        String paymentSecret,
        String memo,
        String descriptionHash,
        long expirySeconds,
        int minFinalCltvExpiry,
        Integer minCltv
) {
    public InvoiceTerms {
        Objects.requireNonNull(paymentHash, "paymentHash");
        Objects.requireNonNull(bolt11, "bolt11");
        if (bolt11.isBlank()) throw new IllegalArgumentException("bolt11 is blank");
        if (amountMsat != null && amountMsat <= 0) {
            throw new IllegalArgumentException("amountMsat must be > 0");
        }
        if (memo != null && descriptionHash != null) {
            throw new IllegalArgumentException("memo and description hash are mutually exclusive");
        }
        if (expirySeconds <= 0) throw new IllegalArgumentException("expiry must be > 0");
        if (minFinalCltvExpiry < 0) throw new IllegalArgumentException("minFinalCltvExpiry must be >= 0");
        if (preimage != null && !preimage.unlocks(paymentHash)) {
            throw new IllegalArgumentException("preimage does not match payment hash");
        }
    }

    public boolean anyAmount() {
        return amountMsat == null;
    }

    /** CLTV delta an incoming HTLC must at least leave us with. */
    public int requiredCltvDelta() {
        return minCltv != null ? minCltv : minFinalCltvExpiry;
    }
}
