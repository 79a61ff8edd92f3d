package com.hold.application.events;

import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.InvoiceState;
import com.hold.domain.invoice.PaymentHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Publishes committed invoice transitions to subscribers in commit order.
 *
 * Store writes go through {@link #commit}: the write and the fan-out happen under one
 * lock, so a failed write publishes nothing and subscribers see transitions in exactly
 * the order they became durable. Subscribing takes the same lock, which lets a
 * subscriber read its catch-up state and start following without a gap or overlap.
 */
public class InvoiceEventBus {

    private static final Logger log = LoggerFactory.getLogger(InvoiceEventBus.class);

    private final Object commitLock = new Object();
    private final List<EventSubscription> subscribers = new CopyOnWriteArrayList<>();
    private final int subscriberBuffer;

    private long sequence;
    private long nextSubscriptionId = 1;

    public InvoiceEventBus(int subscriberBuffer) {
        if (subscriberBuffer <= 0) throw new IllegalArgumentException("subscriberBuffer must be > 0");
        this.subscriberBuffer = subscriberBuffer;
    }

    /**
     * Runs the store write and, if it returns normally, publishes one event per
     * state in {@code transitions}. Exceptions from the write propagate and nothing is published.
     */
    public void commit(HoldInvoice invoice, List<InvoiceState> transitions, Runnable write) {
        synchronized (commitLock) {
            write.run();
            for (InvoiceState state : transitions) {
                publishLocked(invoice.paymentHash(), invoice.bolt11(), state);
            }
        }
    }

    /**
     * Registers a subscriber. {@code catchUp} runs under the commit lock and its events
     * are queued before any live event.
     *
     * @param filter          payment hashes to follow; empty follows every invoice
     * @param completeOnFinal close the subscription after the first final state is delivered
     */
    public EventSubscription subscribe(Set<PaymentHash> filter,
                                       boolean completeOnFinal,
                                       Supplier<List<InvoiceEvent>> catchUp) {
        synchronized (commitLock) {
            EventSubscription sub = new EventSubscription(
                    nextSubscriptionId++, filter, completeOnFinal, subscriberBuffer, this::onClosed);
            for (InvoiceEvent e : catchUp.get()) {
                sub.offer(e);
            }
            if (!sub.isClosed()) {
                subscribers.add(sub);
            }
            log.debug("Subscriber {} registered (filter={}, active={})", sub.id(), filter, subscribers.size());
            return sub;
        }
    }

    /** Sequence of the last committed event. */
    public long currentSequence() {
        synchronized (commitLock) {
            return sequence;
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    private void publishLocked(PaymentHash paymentHash, String bolt11, InvoiceState state) {
        InvoiceEvent event = InvoiceEvent.live(++sequence, paymentHash, bolt11, state);
        for (EventSubscription sub : subscribers) {
            sub.offer(event);
        }
    }

    private void onClosed(EventSubscription sub) {
        subscribers.remove(sub);
        EventSubscription.CloseReason reason = sub.closeReason().orElse(EventSubscription.CloseReason.CANCELLED);
        if (reason == EventSubscription.CloseReason.OVERFLOW) {
            log.warn("Subscriber {} dropped: more than {} undelivered events", sub.id(), subscriberBuffer);
        } else {
            log.debug("Subscriber {} closed ({})", sub.id(), reason);
        }
    }
}
