package com.hold.application.expiry;

import com.hold.application.hook.FailureMessage;
import com.hold.application.ports.InvoiceStore;
import com.hold.application.settlement.InvoiceStateMachine;
import com.hold.application.settlement.PaymentHashLocks;
import com.hold.application.telemetry.EngineObserver;
import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.Htlc;
import com.hold.domain.invoice.HtlcKey;
import com.hold.domain.invoice.InvoiceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fails partial multi-part payments that stopped growing: an UNPAID invoice whose newest
 * live part is older than the MPP timeout loses all its live parts with MPP timeout and
 * stays UNPAID.
 */
public class MppTimeoutSweeper {

    private static final Logger log = LoggerFactory.getLogger(MppTimeoutSweeper.class);

    private final InvoiceStore store;
    private final PaymentHashLocks locks;
    private final InvoiceStateMachine stateMachine;
    private final EngineObserver observer;
    private final Duration timeout;
    private final Clock clock;

    public MppTimeoutSweeper(InvoiceStore store,
                             PaymentHashLocks locks,
                             InvoiceStateMachine stateMachine,
                             EngineObserver observer,
                             Duration timeout,
                             Clock clock) {
        this.store = store;
        this.locks = locks;
        this.stateMachine = stateMachine;
        this.observer = observer == null ? EngineObserver.NOOP : observer;
        this.timeout = timeout;
        this.clock = clock;
    }

    /**
     * @return number of HTLCs failed
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(timeout);
        int failed = 0;
        for (HoldInvoice candidate : store.findWithLiveHtlcs()) {
            if (!timedOut(candidate, cutoff)) continue;
            try {
                failed += locks.withLock(candidate.paymentHash(), () -> timeOut(candidate, cutoff));
            } catch (RuntimeException e) {
                log.error("Could not time out HTLCs of {}", candidate.paymentHash(), e);
            }
        }
        if (failed > 0) observer.htlcsTimedOut(failed);
        return failed;
    }

    private int timeOut(HoldInvoice stale, Instant cutoff) {
        HoldInvoice invoice = store.findByPaymentHash(stale.paymentHash()).orElse(null);
        if (invoice == null || !timedOut(invoice, cutoff)) return 0;

        List<HtlcKey> keys = invoice.liveHtlcs().stream().map(Htlc::key).toList();
        log.warn("MPP timeout for invoice {}: failing {} HTLC(s) totalling {} msat",
                invoice.paymentHash(), keys.size(), invoice.liveAmountMsat());
        stateMachine.failHtlcs(invoice, keys, FailureMessage.MPP_TIMEOUT);
        return keys.size();
    }

    private static boolean timedOut(HoldInvoice invoice, Instant cutoff) {
        return invoice.state() == InvoiceState.UNPAID
                && invoice.latestLiveHtlcAt().map(t -> !t.isAfter(cutoff)).orElse(false);
    }
}
