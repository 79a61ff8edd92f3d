package com.hold.application.support;

import com.hold.application.ports.InvoiceStore;
import com.hold.application.ports.InvoiceStoreException;
import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.Htlc;
import com.hold.domain.invoice.HtlcState;
import com.hold.domain.invoice.InvoiceState;
import com.hold.domain.invoice.PaymentHash;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Keeps detached copies so callers cannot change stored state without {@link #save}.
 */
public final class InMemoryInvoiceStore implements InvoiceStore {

    private final Map<Long, HoldInvoice> rows = new TreeMap<>();
    private long nextInvoiceId = 1;
    private long nextHtlcId = 1;
    private volatile boolean failWrites;

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    @Override
    public synchronized void create(HoldInvoice invoice) {
        checkWritable();
        if (find(invoice.paymentHash()).isPresent()) {
            throw new InvoiceStoreException("duplicate payment hash", null);
        }
        long id = nextInvoiceId++;
        invoice.assignId(id);
        rows.put(id, copy(invoice));
    }

    @Override
    public synchronized void save(HoldInvoice invoice) {
        checkWritable();
        for (Htlc h : invoice.htlcs()) {
            if (h.id() == null) invoice.replaceHtlc(h.withId(nextHtlcId++));
        }
        rows.put(invoice.id(), copy(invoice));
    }

    @Override
    public synchronized Optional<HoldInvoice> findByPaymentHash(PaymentHash paymentHash) {
        return find(paymentHash).map(InMemoryInvoiceStore::copy);
    }

    @Override
    public synchronized List<HoldInvoice> findAll() {
        return rows.values().stream().map(InMemoryInvoiceStore::copy).toList();
    }

    @Override
    public synchronized List<HoldInvoice> findPage(long indexStart, int limit) {
        return rows.values().stream()
                .filter(i -> i.id() >= indexStart)
                .limit(limit)
                .map(InMemoryInvoiceStore::copy)
                .toList();
    }

    @Override
    public synchronized List<HoldInvoice> findWithLiveHtlcs() {
        return rows.values().stream()
                .filter(i -> i.htlcs().stream().anyMatch(h -> h.state() == HtlcState.ACCEPTED))
                .map(InMemoryInvoiceStore::copy)
                .toList();
    }

    @Override
    public synchronized int deleteCancelledCreatedBefore(Instant cutoff) {
        checkWritable();
        List<Long> doomed = new ArrayList<>();
        rows.forEach((id, inv) -> {
            if (inv.state() == InvoiceState.CANCELLED && !inv.createdAt().isAfter(cutoff)) doomed.add(id);
        });
        doomed.forEach(rows::remove);
        return doomed.size();
    }

    private Optional<HoldInvoice> find(PaymentHash hash) {
        return rows.values().stream().filter(i -> i.paymentHash().equals(hash)).findFirst();
    }

    private void checkWritable() {
        if (failWrites) throw new InvoiceStoreException("disk on fire", null);
    }

    private static HoldInvoice copy(HoldInvoice i) {
        return HoldInvoice.restore(i.id(), i.terms(), i.preimage(), i.state(),
                i.createdAt(), i.acceptedAt(), i.settledAt(), List.copyOf(i.htlcs()));
    }
}
