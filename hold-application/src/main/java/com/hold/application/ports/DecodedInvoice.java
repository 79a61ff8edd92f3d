package com.hold.application.ports;

import com.hold.domain.invoice.PaymentHash;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

public record DecodedInvoice(
        String network,
        PaymentHash paymentHash,
        Long amountMsat,
        String paymentSecret,
        String description,
        String descriptionHash,
        long expirySeconds,
        int minFinalCltvExpiry,
        Instant timestamp,
        String payee,
        List<RoutingHint> routingHints
) {
    public DecodedInvoice {
        Objects.requireNonNull(paymentHash, "paymentHash");
        Objects.requireNonNull(payee, "payee");
        routingHints = routingHints == null ? List.of() : List.copyOf(routingHints);
    }

    /**
     * True when the node is the payee or the entry point of one of the routing hints.
     */
    public boolean relatedTo(String nodeId) {
        if (nodeId == null) return false;
        String id = nodeId.toLowerCase(Locale.ROOT);
        if (payee.equalsIgnoreCase(id)) return true;
        return routingHints.stream()
                .flatMap(h -> h.hops().stream())
                .anyMatch(hop -> hop.publicKey().equalsIgnoreCase(id));
    }
}
