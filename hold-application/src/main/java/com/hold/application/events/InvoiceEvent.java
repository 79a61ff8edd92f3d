package com.hold.application.events;

import com.hold.domain.invoice.InvoiceState;
import com.hold.domain.invoice.PaymentHash;

import java.util.Objects;

/**
 * One committed invoice transition.
 *
 * @param sequence global commit order; replayed events carry the sequence they were replayed at
 * @param bolt11   null when replaying a state for an invoice that does not exist yet
 */
public record InvoiceEvent(
        long sequence,
        PaymentHash paymentHash,
        String bolt11,
        InvoiceState state,
        boolean replay
) {
    public InvoiceEvent {
        Objects.requireNonNull(paymentHash, "paymentHash");
        Objects.requireNonNull(state, "state");
    }

    static InvoiceEvent live(long sequence, PaymentHash paymentHash, String bolt11, InvoiceState state) {
        return new InvoiceEvent(sequence, paymentHash, bolt11, state, false);
    }

    public static InvoiceEvent replayed(long sequence, PaymentHash paymentHash, String bolt11, InvoiceState state) {
        return new InvoiceEvent(sequence, paymentHash, bolt11, state, true);
    }
}
