package com.hold.application.events;

import com.hold.domain.invoice.InvoiceState;
import com.hold.domain.invoice.PaymentHash;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * A subscriber's view of the event bus: a bounded queue the bus offers into without blocking.
 *
 * The consumer drains it with {@link #next(Duration)} until {@link #isDrained()}.
 */
public final class EventSubscription implements AutoCloseable {

    public enum CloseReason {
        /** Subscriber went away. */
        CANCELLED,
        /** Tracked invoice reached a final state. */
        COMPLETED,
        /** Subscriber fell further behind than its buffer allows. */
        OVERFLOW
    }

    private final long id;
    private final Set<PaymentHash> filter;
    private final boolean completeOnFinal;
    private final BlockingQueue<InvoiceEvent> queue;
    private final Consumer<EventSubscription> onClose;

    private final Map<PaymentHash, InvoiceState> lastDelivered = new HashMap<>();
    private volatile CloseReason closeReason;

    EventSubscription(long id,
                      Set<PaymentHash> filter,
                      boolean completeOnFinal,
                      int capacity,
                      Consumer<EventSubscription> onClose) {
        this.id = id;
        this.filter = filter == null ? Set.of() : Set.copyOf(filter);
        this.completeOnFinal = completeOnFinal;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.onClose = onClose;
    }

    /**
     * Called by the bus with its commit lock held. Never blocks.
     */
    void offer(InvoiceEvent event) {
        if (closeReason != null) return;
        if (!filter.isEmpty() && !filter.contains(event.paymentHash())) return;

        // a tracked hash can be replayed as UNPAID before its creation is committed
        synchronized (lastDelivered) {
            if (lastDelivered.get(event.paymentHash()) == event.state()) return;
            if (!filter.isEmpty()) lastDelivered.put(event.paymentHash(), event.state());
        }

        if (!queue.offer(event)) {
            close(CloseReason.OVERFLOW);
            return;
        }
        if (completeOnFinal && event.state().isFinal()) {
            close(CloseReason.COMPLETED);
        }
    }

    /**
     * Waits up to {@code timeout} for the next event.
     */
    public Optional<InvoiceEvent> next(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /** True once the subscription is closed and every queued event was taken. */
    public boolean isDrained() {
        return closeReason != null && queue.isEmpty();
    }

    public boolean isClosed() {
        return closeReason != null;
    }

    public Optional<CloseReason> closeReason() {
        return Optional.ofNullable(closeReason);
    }

    public long id() {
        return id;
    }

    @Override
    public void close() {
        close(CloseReason.CANCELLED);
    }

    private void close(CloseReason reason) {
        synchronized (this) {
            if (closeReason != null) return;
            closeReason = reason;
        }
        onClose.accept(this);
    }
}
