package com.hold.application.events;

import com.hold.application.ports.InvoiceStore;
import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.InvoiceState;
import com.hold.domain.invoice.PaymentHash;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Catch-up-then-follow subscriptions over the {@link InvoiceEventBus}.
 */
public class TrackService {

    private final InvoiceStore store;
    private final InvoiceEventBus bus;

    public TrackService(InvoiceStore store, InvoiceEventBus bus) {
        this.store = store;
        this.bus = bus;
    }

    /**
     * Follows one invoice. The stream starts with the invoice's history from UNPAID
     * (or a bare UNPAID if it does not exist yet) and completes after a final state.
     */
    public EventSubscription track(PaymentHash paymentHash) {
        return bus.subscribe(Set.of(paymentHash), true, () -> {
            long seq = bus.currentSequence();
            Optional<HoldInvoice> invoice = store.findByPaymentHash(paymentHash);
            if (invoice.isEmpty()) {
                return List.of(InvoiceEvent.replayed(seq, paymentHash, null, InvoiceState.UNPAID));
            }
            HoldInvoice inv = invoice.get();
            return history(inv).stream()
                    .map(s -> InvoiceEvent.replayed(seq, paymentHash, inv.bolt11(), s))
                    .toList();
        });
    }

    /**
     * Follows many invoices. With a filter, existing invoices in it are first reported in
     * their current state; without one, only live transitions of every invoice are streamed.
     */
    public EventSubscription trackAll(Set<PaymentHash> filter) {
        Set<PaymentHash> hashes = filter == null ? Set.of() : Set.copyOf(filter);
        return bus.subscribe(hashes, false, () -> {
            if (hashes.isEmpty()) return List.of();
            long seq = bus.currentSequence();
            return hashes.stream()
                    .map(store::findByPaymentHash)
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparing(HoldInvoice::id))
                    .map(inv -> InvoiceEvent.replayed(seq, inv.paymentHash(), inv.bolt11(), inv.state()))
                    .toList();
        });
    }

    /**
     * States the invoice went through, rebuilt from its durable record.
     */
    static List<InvoiceState> history(HoldInvoice invoice) {
        List<InvoiceState> states = new ArrayList<>();
        states.add(InvoiceState.UNPAID);
        if (invoice.acceptedAt() != null) {
            states.add(InvoiceState.ACCEPTED);
        }
        if (invoice.state() != InvoiceState.UNPAID && !states.contains(invoice.state())) {
            states.add(invoice.state());
        }
        return states;
    }
}
