package com.hold.domain.invoice;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Hold invoice aggregate: the invoice terms, its lifecycle state and the HTLCs
 * paying it. Only the transition methods below change {@code state},
 * {@code acceptedAt} and {@code settledAt}.
 */
public final class HoldInvoice {

    private Long id;
    private final InvoiceTerms terms;
    private final Instant createdAt;

    private Preimage preimage;
    private InvoiceState state;
    private Instant acceptedAt;
    private Instant settledAt;
    private final List<Htlc> htlcs = new ArrayList<>();

    private HoldInvoice(InvoiceTerms terms, Instant createdAt) {
        this.terms = Objects.requireNonNull(terms, "terms");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.preimage = terms.preimage();
        this.state = InvoiceState.UNPAID;
    }

    public static HoldInvoice create(InvoiceTerms terms, Instant now) {
        return new HoldInvoice(terms, now);
    }

    /**
     * Rehydrate from persistence. The stored state is authoritative.
     */
    public static HoldInvoice restore(long id,
                                      InvoiceTerms terms,
                                      Preimage preimage,
                                      InvoiceState state,
                                      Instant createdAt,
                                      Instant acceptedAt,
                                      Instant settledAt,
                                      List<Htlc> htlcs) {
        HoldInvoice inv = new HoldInvoice(terms, createdAt);
        inv.id = id;
        inv.preimage = preimage != null ? preimage : terms.preimage();
        inv.state = Objects.requireNonNull(state, "state");
        inv.acceptedAt = acceptedAt;
        inv.settledAt = settledAt;
        if (htlcs != null) inv.htlcs.addAll(htlcs);
        return inv;
    }

    public void assignId(long newId) {
        if (id != null) {
            throw new IllegalStateException("invoice " + terms.paymentHash() + " already has id " + id);
        }
        this.id = newId;
    }

    /** Replaces the in-memory HTLC with its persisted copy (carrying the row id). */
    public void replaceHtlc(Htlc stored) {
        for (int i = 0; i < htlcs.size(); i++) {
            if (htlcs.get(i).key().equals(stored.key())) {
                htlcs.set(i, stored);
                return;
            }
        }
        throw new IllegalArgumentException("unknown HTLC " + stored.key());
    }

    // --- transitions ---

    /**
     * Records a new HTLC part in ACCEPTED state. Only legal while UNPAID or ACCEPTED.
     */
    public Htlc addHtlc(HtlcKey key, long msat, long cltvExpiry, Instant now) {
        if (state.isFinal()) {
            throw new InvalidInvoiceTransitionException(state,
                    "invoice " + terms.paymentHash() + " is " + state.label() + ", cannot add HTLC");
        }
        if (findHtlc(key).isPresent()) {
            throw new IllegalArgumentException("HTLC " + key + " already recorded");
        }
        Htlc htlc = Htlc.accepted(key, msat, cltvExpiry, now);
        htlcs.add(htlc);
        return htlc;
    }

    /**
     * Records a part the engine refused, already CANCELLED, so a redelivery is answered
     * from the stored row. Legal in every state; the invoice state is left as it is.
     */
    public Htlc addRejectedHtlc(HtlcKey key, long msat, long cltvExpiry, Instant now) {
        if (findHtlc(key).isPresent()) {
            throw new IllegalArgumentException("HTLC " + key + " already recorded");
        }
        Htlc htlc = Htlc.rejected(key, msat, cltvExpiry, now);
        htlcs.add(htlc);
        return htlc;
    }

    public void accept(Instant now) {
        requireTransition(InvoiceState.ACCEPTED);
        this.state = InvoiceState.ACCEPTED;
        this.acceptedAt = now;
    }

    /**
     * ACCEPTED to PAID. Every live HTLC is resolved with the preimage.
     */
    public List<Htlc> settle(Preimage p, Instant now) {
        Objects.requireNonNull(p, "preimage");
        if (!p.unlocks(terms.paymentHash())) {
            throw new IllegalArgumentException("preimage does not match payment hash " + terms.paymentHash());
        }
        requireTransition(InvoiceState.PAID);
        List<Htlc> resolved = moveLive(HtlcState.PAID);
        this.preimage = p;
        this.state = InvoiceState.PAID;
        this.settledAt = now;
        return resolved;
    }

    /**
     * UNPAID or ACCEPTED to CANCELLED. Returns the HTLCs that were live and must be failed.
     */
    public List<Htlc> cancel() {
        requireTransition(InvoiceState.CANCELLED);
        List<Htlc> failed = moveLive(HtlcState.CANCELLED);
        this.state = InvoiceState.CANCELLED;
        return failed;
    }

    /**
     * Fails a single live HTLC without changing the invoice state.
     */
    public Htlc failHtlc(HtlcKey key) {
        for (int i = 0; i < htlcs.size(); i++) {
            Htlc h = htlcs.get(i);
            if (h.key().equals(key)) {
                if (!h.isLive()) {
                    throw new IllegalStateException("HTLC " + key + " is " + h.state());
                }
                Htlc failed = h.withState(HtlcState.CANCELLED);
                htlcs.set(i, failed);
                return failed;
            }
        }
        throw new IllegalArgumentException("unknown HTLC " + key);
    }

    private void requireTransition(InvoiceState next) {
        if (!state.canTransitionTo(next)) {
            throw new InvalidInvoiceTransitionException(state,
                    "invoice " + terms.paymentHash() + ": " + state + " -> " + next + " not allowed");
        }
    }

    private List<Htlc> moveLive(HtlcState next) {
        List<Htlc> moved = new ArrayList<>();
        for (int i = 0; i < htlcs.size(); i++) {
            Htlc h = htlcs.get(i);
            if (h.isLive()) {
                Htlc m = h.withState(next);
                htlcs.set(i, m);
                moved.add(m);
            }
        }
        return moved;
    }

    // --- queries ---

    public Optional<Htlc> findHtlc(HtlcKey key) {
        return htlcs.stream().filter(h -> h.key().equals(key)).findFirst();
    }

    public List<Htlc> liveHtlcs() {
        return htlcs.stream().filter(Htlc::isLive).toList();
    }

    /** Sum of ACCEPTED and PAID parts. */
    public long amountPaidMsat() {
        return htlcs.stream()
                .filter(h -> h.state() != HtlcState.CANCELLED)
                .mapToLong(Htlc::msat)
                .sum();
    }

    public long liveAmountMsat() {
        return liveHtlcs().stream().mapToLong(Htlc::msat).sum();
    }

    /** Arrival time of the most recent live part. */
    public Optional<Instant> latestLiveHtlcAt() {
        return liveHtlcs().stream().map(Htlc::createdAt).max(Instant::compareTo);
    }

    /** Preimage as clients may see it: only after settlement. */
    public Optional<Preimage> revealedPreimage() {
        return state == InvoiceState.PAID ? Optional.ofNullable(preimage) : Optional.empty();
    }

    public boolean isFinal() {
        return state.isFinal();
    }

    public Long id() { return id; }
    public InvoiceTerms terms() { return terms; }
    public PaymentHash paymentHash() { return terms.paymentHash(); }
    public String bolt11() { return terms.bolt11(); }
    public Preimage preimage() { return preimage; }
    public InvoiceState state() { return state; }
    public Instant createdAt() { return createdAt; }
    public Instant acceptedAt() { return acceptedAt; }
    public Instant settledAt() { return settledAt; }
    public List<Htlc> htlcs() { return Collections.unmodifiableList(htlcs); }
}
