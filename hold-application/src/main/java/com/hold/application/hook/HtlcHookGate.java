package com.hold.application.hook;

import com.hold.application.mpp.MppAggregator;
import com.hold.application.mpp.MppVerdict;
import com.hold.application.ports.InvoiceStore;
import com.hold.application.settlement.HtlcResolvers;
import com.hold.application.settlement.InvoiceStateMachine;
import com.hold.application.settlement.PaymentHashLocks;
import com.hold.application.telemetry.EngineObserver;
import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.Htlc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decides, for every HTLC the host node receives, whether the engine holds it,
 * fails it, resolves it or leaves it to the host.
 *
 * Order of checks:
 * <ol>
 *   <li>unknown payment hash: continue</li>
 *   <li>HTLC already recorded (host redelivery): answer from its stored state</li>
 *   <li>payment secret mismatch: fail, incorrect payment details</li>
 *   <li>CLTV delta below the invoice minimum: fail, final incorrect CLTV expiry</li>
 *   <li>invoice PAID or CANCELLED: fail, incorrect payment details</li>
 *   <li>overpayment bound exceeded: fail, incorrect payment details</li>
 *   <li>otherwise record the part and hold</li>
 * </ol>
 * Rejected parts are stored as CANCELLED rows.
 */
public class HtlcHookGate {

    private static final Logger log = LoggerFactory.getLogger(HtlcHookGate.class);

    private final InvoiceStore store;
    private final PaymentHashLocks locks;
    private final MppAggregator mpp;
    private final InvoiceStateMachine stateMachine;
    private final HtlcResolvers resolvers;
    private final EngineObserver observer;

    public HtlcHookGate(InvoiceStore store,
                        PaymentHashLocks locks,
                        MppAggregator mpp,
                        InvoiceStateMachine stateMachine,
                        HtlcResolvers resolvers,
                        EngineObserver observer) {
        this.store = store;
        this.locks = locks;
        this.mpp = mpp;
        this.stateMachine = stateMachine;
        this.resolvers = resolvers;
        this.observer = observer == null ? EngineObserver.NOOP : observer;
    }

    /**
     * Never throws: an engine fault is logged and the HTLC is left to the host.
     */
    public HookDecision onHtlcAccepted(HtlcRequest request) {
        try {
            return locks.withLock(request.paymentHash(), () -> decide(request));
        } catch (RuntimeException e) {
            log.error("HTLC {} for {} could not be handled, leaving it to the node",
                    request.key(), request.paymentHash(), e);
            return HookDecision.CONTINUE;
        }
    }

    private HookDecision decide(HtlcRequest req) {
        Optional<HoldInvoice> found = store.findByPaymentHash(req.paymentHash());
        if (found.isEmpty()) {
            log.debug("HTLC {} for {} is not ours", req.key(), req.paymentHash());
            return HookDecision.CONTINUE;
        }
        HoldInvoice invoice = found.get();

        Optional<Htlc> known = invoice.findHtlc(req.key());
        if (known.isPresent()) {
            return redelivered(invoice, known.get());
        }

        String expectedSecret = invoice.terms().paymentSecret();
        if (expectedSecret != null && !expectedSecret.equalsIgnoreCase(req.paymentSecret())) {
            return reject(invoice, req, FailureMessage.INCORRECT_PAYMENT_DETAILS, "payment secret mismatch");
        }

        int required = invoice.terms().requiredCltvDelta();
        if (req.cltvExpiryRelative() < required) {
            return reject(invoice, req, FailureMessage.FINAL_INCORRECT_CLTV_EXPIRY,
                    "CLTV delta " + req.cltvExpiryRelative() + " below minimum " + required);
        }

        if (invoice.isFinal()) {
            return reject(invoice, req, FailureMessage.INCORRECT_PAYMENT_DETAILS,
                    "invoice is " + invoice.state().label());
        }

        MppVerdict verdict = mpp.offer(invoice, req.amountMsat());
        if (!verdict.accepted()) {
            return reject(invoice, req, FailureMessage.INCORRECT_PAYMENT_DETAILS,
                    "overpayment, total " + verdict.totalMsat() + " msat");
        }

        stateMachine.recordHtlc(invoice, req, verdict.completesInvoice());
        log.debug("Holding HTLC {} for {} ({} msat, total {} msat)",
                req.key(), req.paymentHash(), req.amountMsat(), verdict.totalMsat());
        return HookDecision.hold(resolvers.register(req.paymentHash(), req.key()));
    }

    private HookDecision redelivered(HoldInvoice invoice, Htlc htlc) {
        log.debug("HTLC {} for {} redelivered in state {}", htlc.key(), invoice.paymentHash(), htlc.state());
        return switch (htlc.state()) {
            case ACCEPTED -> HookDecision.hold(resolvers.register(invoice.paymentHash(), htlc.key()));
            case PAID -> HookDecision.resolve(invoice.preimage());
            case CANCELLED -> HookDecision.fail(FailureMessage.INCORRECT_PAYMENT_DETAILS);
        };
    }

    private HookDecision reject(HoldInvoice invoice, HtlcRequest req, FailureMessage reason, String why) {
        log.warn("Rejected HTLC {} for {}: {}", req.key(), invoice.paymentHash(), why);
        stateMachine.recordRejectedHtlc(invoice, req);
        observer.htlcRejected(reason);
        return HookDecision.fail(reason);
    }
}
