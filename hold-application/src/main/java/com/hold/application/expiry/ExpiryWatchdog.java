package com.hold.application.expiry;

import com.hold.application.hook.FailureMessage;
import com.hold.application.ports.InvoiceStore;
import com.hold.application.settlement.InvoiceStateMachine;
import com.hold.application.settlement.PaymentHashLocks;
import com.hold.application.telemetry.EngineObserver;
import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.HtlcKey;
import com.hold.domain.invoice.InvoiceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fails held HTLCs before the node has to force-close over them.
 *
 * On every new block, each live HTLC with {@code cltvExpiry - height <= deadline} is failed
 * with incorrect payment details. An ACCEPTED invoice with such an HTLC is cancelled as a
 * whole; an UNPAID one only loses the expiring parts and stays UNPAID.
 */
public class ExpiryWatchdog {

    private static final Logger log = LoggerFactory.getLogger(ExpiryWatchdog.class);

    private final InvoiceStore store;
    private final PaymentHashLocks locks;
    private final InvoiceStateMachine stateMachine;
    private final EngineObserver observer;
    private final long deadlineBlocks;

    private long bestHeight;

    public ExpiryWatchdog(InvoiceStore store,
                          PaymentHashLocks locks,
                          InvoiceStateMachine stateMachine,
                          EngineObserver observer,
                          long deadlineBlocks) {
        if (deadlineBlocks < 0) throw new IllegalArgumentException("deadlineBlocks must be >= 0");
        this.store = store;
        this.locks = locks;
        this.stateMachine = stateMachine;
        this.observer = observer == null ? EngineObserver.NOOP : observer;
        this.deadlineBlocks = deadlineBlocks;

        if (isDisabled()) {
            log.warn("Not cancelling HTLCs close to expiry");
        } else {
            log.info("Failing HTLCs {} blocks before expiry", deadlineBlocks);
        }
    }

    /**
     * Handles a block notification. Heights not above the best seen so far are ignored.
     *
     * @return number of HTLCs failed
     */
    public synchronized int blockAdded(long height) {
        if (isDisabled()) return 0;
        if (height <= bestHeight) {
            log.warn("Added block height {} is not above best height {}", height, bestHeight);
            return 0;
        }
        bestHeight = height;
        log.debug("New best height {}", height);

        int failed = 0;
        for (HoldInvoice candidate : store.findWithLiveHtlcs()) {
            if (expiring(candidate, height).isEmpty()) continue;
            try {
                failed += locks.withLock(candidate.paymentHash(), () -> expire(candidate, height));
            } catch (RuntimeException e) {
                log.error("Could not expire HTLCs of {}", candidate.paymentHash(), e);
            }
        }
        if (failed > 0) observer.htlcsExpired(failed);
        return failed;
    }

    public synchronized long bestHeight() {
        return bestHeight;
    }

    public boolean isDisabled() {
        return deadlineBlocks == 0;
    }

    private int expire(HoldInvoice stale, long height) {
        // re-read under the lock; settle or cancel may have won the race
        HoldInvoice invoice = store.findByPaymentHash(stale.paymentHash()).orElse(null);
        if (invoice == null) return 0;
        List<HtlcKey> expiring = expiring(invoice, height);
        if (expiring.isEmpty()) return 0;

        if (invoice.state() == InvoiceState.ACCEPTED) {
            log.warn("Cancelling invoice {}: {} HTLC(s) within {} blocks of expiry at height {}",
                    invoice.paymentHash(), expiring.size(), deadlineBlocks, height);
            int live = invoice.liveHtlcs().size();
            stateMachine.cancel(invoice, FailureMessage.INCORRECT_PAYMENT_DETAILS);
            return live;
        }

        log.warn("Failing {} HTLC(s) of unpaid invoice {} within {} blocks of expiry at height {}",
                expiring.size(), invoice.paymentHash(), deadlineBlocks, height);
        stateMachine.failHtlcs(invoice, expiring, FailureMessage.INCORRECT_PAYMENT_DETAILS);
        return expiring.size();
    }

    private List<HtlcKey> expiring(HoldInvoice invoice, long height) {
        return invoice.liveHtlcs().stream()
                .filter(h -> h.cltvExpiry() - height <= deadlineBlocks)
                .map(h -> h.key())
                .toList();
    }
}
