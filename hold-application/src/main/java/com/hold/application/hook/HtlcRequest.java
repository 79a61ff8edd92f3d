package com.hold.application.hook;

import com.hold.domain.invoice.HtlcKey;
import com.hold.domain.invoice.PaymentHash;

import java.util.Objects;

/**
 * One incoming HTLC as the host node reports it.
 *
 * @param cltvExpiryRelative blocks left until {@code cltvExpiry} at the current height
 * @param paymentSecret      hex from the onion payload, null if absent
 */
public record HtlcRequest(
        PaymentHash paymentHash,
        HtlcKey key,
        long amountMsat,
        long cltvExpiry,
        long cltvExpiryRelative,
        String paymentSecret
) {
    public HtlcRequest {
        Objects.requireNonNull(paymentHash, "paymentHash");
        Objects.requireNonNull(key, "key");
        if (amountMsat <= 0) throw new IllegalArgumentException("amountMsat must be > 0");
    }
}
