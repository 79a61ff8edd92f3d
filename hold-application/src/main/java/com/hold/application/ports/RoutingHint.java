package com.hold.application.ports;

import java.util.List;
import java.util.Objects;

/**
 * Private route to the payee, one BOLT11 {@code r} field.
 */
public record RoutingHint(List<Hop> hops) {

    public RoutingHint {
        Objects.requireNonNull(hops, "hops");
        if (hops.isEmpty()) throw new IllegalArgumentException("routing hint has no hops");
        hops = List.copyOf(hops);
    }

    /**
     * @param publicKey      33-byte compressed node key, hex
     * @param shortChannelId channel id in its 8-byte integer form
     */
    public record Hop(
            String publicKey,
            long shortChannelId,
            long baseFeeMsat,
            long ppmFee,
            int cltvExpiryDelta
    ) {
        public Hop {
            Objects.requireNonNull(publicKey, "publicKey");
            if (publicKey.length() != 66) {
                throw new IllegalArgumentException("hop public key must be 33 bytes");
            }
            if (baseFeeMsat < 0 || ppmFee < 0 || cltvExpiryDelta < 0) {
                throw new IllegalArgumentException("hop fees and cltv delta must be >= 0");
            }
        }
    }
}
