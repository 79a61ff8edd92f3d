package com.hold.application.settlement;

import com.hold.application.events.InvoiceEventBus;
import com.hold.application.hook.FailureMessage;
import com.hold.application.hook.HookDecision;
import com.hold.application.hook.HtlcRequest;
import com.hold.application.ports.InvoiceStore;
import com.hold.application.telemetry.EngineObserver;
import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.Htlc;
import com.hold.domain.invoice.HtlcKey;
import com.hold.domain.invoice.InvoiceState;
import com.hold.domain.invoice.Preimage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.List;

/**
 * The only writer of invoice state. Each transition mutates the aggregate, persists it
 * with its HTLC rows and publishes the resulting event as one commit; only after the
 * commit are waiting HTLCs answered.
 *
 * Callers must hold the {@link PaymentHashLocks} entry of the invoice.
 */
public class InvoiceStateMachine {

    private static final Logger log = LoggerFactory.getLogger(InvoiceStateMachine.class);

    private final InvoiceStore store;
    private final InvoiceEventBus bus;
    private final HtlcResolvers resolvers;
    private final EngineObserver observer;
    private final Clock clock;

    public InvoiceStateMachine(InvoiceStore store,
                               InvoiceEventBus bus,
                               HtlcResolvers resolvers,
                               EngineObserver observer,
                               Clock clock) {
        this.store = store;
        this.bus = bus;
        this.resolvers = resolvers;
        this.observer = observer == null ? EngineObserver.NOOP : observer;
        this.clock = clock;
    }

    public void create(HoldInvoice invoice) {
        bus.commit(invoice, List.of(InvoiceState.UNPAID), () -> store.create(invoice));
        log.info("Created hold invoice {} (id={})", invoice.paymentHash(), invoice.id());
    }

    /**
     * Stores a new ACCEPTED part and, when {@code completesInvoice}, moves the invoice
     * from UNPAID to ACCEPTED in the same commit.
     */
    public Htlc recordHtlc(HoldInvoice invoice, HtlcRequest request, boolean completesInvoice) {
        invoice.addHtlc(request.key(), request.amountMsat(), request.cltvExpiry(), clock.instant());
        List<InvoiceState> transitions = List.of();
        if (completesInvoice) {
            invoice.accept(clock.instant());
            transitions = List.of(InvoiceState.ACCEPTED);
        }
        bus.commit(invoice, transitions, () -> store.save(invoice));
        observer.htlcAccepted(request.amountMsat());
        if (completesInvoice) {
            log.info("Accepted hold invoice {} with {} HTLCs ({} msat)",
                    invoice.paymentHash(), invoice.liveHtlcs().size(), invoice.amountPaidMsat());
        }
        return invoice.findHtlc(request.key()).orElseThrow();
    }

    /**
     * Stores a refused part as CANCELLED. No transition is published.
     */
    public void recordRejectedHtlc(HoldInvoice invoice, HtlcRequest request) {
        invoice.addRejectedHtlc(request.key(), request.amountMsat(), request.cltvExpiry(), clock.instant());
        bus.commit(invoice, List.of(), () -> store.save(invoice));
    }

    public void settle(HoldInvoice invoice, Preimage preimage) {
        List<Htlc> resolved = invoice.settle(preimage, clock.instant());
        bus.commit(invoice, List.of(InvoiceState.PAID), () -> store.save(invoice));
        for (Htlc h : resolved) {
            resolvers.resolve(invoice.paymentHash(), h.key(), HookDecision.resolve(preimage));
        }
        observer.invoiceSettled(resolved.size());
        log.info("Settled hold invoice {} with {} HTLCs", invoice.paymentHash(), resolved.size());
    }

    public void cancel(HoldInvoice invoice, FailureMessage reason) {
        List<Htlc> failed = invoice.cancel();
        bus.commit(invoice, List.of(InvoiceState.CANCELLED), () -> store.save(invoice));
        failAll(invoice, failed, reason);
        observer.invoiceCancelled(failed.size());
        log.info("Cancelled hold invoice {} with {} HTLCs", invoice.paymentHash(), failed.size());
    }

    /**
     * Fails individual live HTLCs; the invoice state is left as it is.
     */
    public void failHtlcs(HoldInvoice invoice, Collection<HtlcKey> keys, FailureMessage reason) {
        if (keys.isEmpty()) return;
        List<Htlc> failed = keys.stream().map(invoice::failHtlc).toList();
        bus.commit(invoice, List.of(), () -> store.save(invoice));
        failAll(invoice, failed, reason);
    }

    private void failAll(HoldInvoice invoice, List<Htlc> htlcs, FailureMessage reason) {
        HookDecision fail = HookDecision.fail(reason);
        for (Htlc h : htlcs) {
            resolvers.resolve(invoice.paymentHash(), h.key(), fail);
        }
    }
}
