package com.hold.api.rest.dto;

import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.Htlc;
import com.hold.domain.invoice.Preimage;

import java.time.Instant;
import java.util.List;

public record InvoiceResponse(
        long id,
        String paymentHash,
        String preimage,
        String bolt11,
        String state,
        Integer minCltv,
        String createdAt,
        String acceptedAt,
        String settledAt,
        List<HtlcResponse> htlcs
) {

    public record HtlcResponse(
            long id,
            String state,
            String scid,
            long channelId,
            long msat,
            long cltvExpiry,
            String createdAt
    ) {
        static HtlcResponse from(Htlc h) {
            return new HtlcResponse(
                    h.id() == null ? 0 : h.id(),
                    h.state().name(),
                    h.key().scid(),
                    h.key().channelId(),
                    h.msat(),
                    h.cltvExpiry(),
                    h.createdAt().toString()
            );
        }
    }

    public static InvoiceResponse from(HoldInvoice inv) {
        return new InvoiceResponse(
                inv.id(),
                inv.paymentHash().hex(),
                inv.revealedPreimage().map(Preimage::hex).orElse(null),
                inv.bolt11(),
                inv.state().name(),
                inv.terms().minCltv(),
                inv.createdAt().toString(),
                iso(inv.acceptedAt()),
                iso(inv.settledAt()),
                inv.htlcs().stream().map(HtlcResponse::from).toList()
        );
    }

    private static String iso(Instant t) {
        return t == null ? null : t.toString();
    }
}
