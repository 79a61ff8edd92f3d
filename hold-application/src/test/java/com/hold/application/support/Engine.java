package com.hold.application.support;

import com.hold.application.config.HoldSettings;
import com.hold.application.events.InvoiceEventBus;
import com.hold.application.events.TrackService;
import com.hold.application.expiry.ExpiryWatchdog;
import com.hold.application.expiry.MppTimeoutSweeper;
import com.hold.application.hook.HookDecision;
import com.hold.application.hook.HtlcHookGate;
import com.hold.application.hook.HtlcRequest;
import com.hold.application.mpp.MppAggregator;
import com.hold.application.service.CreateInvoiceCommand;
import com.hold.application.service.HoldInvoiceService;
import com.hold.application.settlement.HtlcResolvers;
import com.hold.application.settlement.InvoiceStateMachine;
import com.hold.application.settlement.PaymentHashLocks;
import com.hold.application.telemetry.EngineObserver;
import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.HtlcKey;
import com.hold.domain.invoice.PaymentHash;
import com.hold.domain.invoice.Preimage;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The whole engine wired against in-memory collaborators.
 */
public final class Engine {

    public final MutableClock clock = new MutableClock(Instant.parse("2024-08-17T12:00:00Z"));
    public final InMemoryInvoiceStore store = new InMemoryInvoiceStore();
    public final FakeInvoiceCodec codec = new FakeInvoiceCodec();
    public final PaymentHashLocks locks = new PaymentHashLocks();
    public final HtlcResolvers resolvers = new HtlcResolvers();
    public final InvoiceEventBus bus;
    public final InvoiceStateMachine stateMachine;
    public final HtlcHookGate gate;
    public final ExpiryWatchdog watchdog;
    public final MppTimeoutSweeper sweeper;
    public final TrackService tracks;
    public final HoldInvoiceService service;
    public final AtomicInteger rejected = new AtomicInteger();

    private final AtomicInteger nextHtlcId = new AtomicInteger();

    public Engine() {
        this(HoldSettings.defaults());
    }

    public Engine(HoldSettings settings) {
        EngineObserver observer = new EngineObserver() {
            @Override
            public void htlcRejected(com.hold.application.hook.FailureMessage reason) {
                rejected.incrementAndGet();
            }
        };
        bus = new InvoiceEventBus(settings.subscriberBuffer());
        stateMachine = new InvoiceStateMachine(store, bus, resolvers, observer, clock);
        gate = new HtlcHookGate(store, locks, new MppAggregator(settings.overpaymentFactor()),
                stateMachine, resolvers, observer);
        watchdog = new ExpiryWatchdog(store, locks, stateMachine, observer, settings.expiryDeadlineBlocks());
        sweeper = new MppTimeoutSweeper(store, locks, stateMachine, observer, settings.mppTimeout(), clock);
        tracks = new TrackService(store, bus);
        service = new HoldInvoiceService(store, codec, codec, locks, stateMachine, tracks, settings, clock, "test");
    }

    public static HoldSettings settings(double factor, long deadline, Duration mppTimeout, int buffer) {
        return new HoldSettings(factor, mppTimeout, deadline, 3600, 18, buffer);
    }

    public String invoice(Preimage preimage, Long amountMsat) {
        return service.invoice(CreateInvoiceCommand.of(preimage.paymentHash(), amountMsat, "test"));
    }

    public HoldInvoice load(PaymentHash hash) {
        return store.findByPaymentHash(hash).orElseThrow();
    }

    /** An HTLC from a fresh channel slot, with the right secret and ample CLTV. */
    public HtlcRequest htlc(PaymentHash hash, long msat) {
        return htlc(hash, msat, 200);
    }

    public HtlcRequest htlc(PaymentHash hash, long msat, long cltvExpiry) {
        return new HtlcRequest(hash, new HtlcKey("103x1x0", nextHtlcId.getAndIncrement()),
                msat, cltvExpiry, 80, FakeInvoiceCodec.SECRET);
    }

    public HookDecision pay(PaymentHash hash, long msat) {
        return gate.onHtlcAccepted(htlc(hash, msat));
    }
}
