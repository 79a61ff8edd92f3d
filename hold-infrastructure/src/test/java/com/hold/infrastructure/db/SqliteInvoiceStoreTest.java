package com.hold.infrastructure.db;

import com.hold.application.ports.InvoiceStoreException;
import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.Htlc;
import com.hold.domain.invoice.HtlcKey;
import com.hold.domain.invoice.HtlcState;
import com.hold.domain.invoice.InvoiceState;
import com.hold.domain.invoice.InvoiceTerms;
import com.hold.domain.invoice.Preimage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteInvoiceStoreTest {

    static final Instant T0 = Instant.parse("2024-08-17T12:00:00Z");
    static final String SECRET = "5e".repeat(32);

    @TempDir
    Path dir;

    SqliteInvoiceStore store;

    @BeforeEach
    void setUp() {
        Database db = new Database("jdbc:sqlite:" + dir.resolve("data/hold.sqlite"), 5000);
        db.initSchema();
        store = new SqliteInvoiceStore(db);
    }

    @Test
    void createAssignsIncreasingIdsAndRoundTripsTerms() {
        HoldInvoice a = newInvoice(Preimage.random(), 1_000L, T0);
        HoldInvoice b = newInvoice(Preimage.random(), null, T0);

        store.create(a);
        store.create(b);

        assertThat(b.id()).isGreaterThan(a.id());
        HoldInvoice loaded = store.findByPaymentHash(a.paymentHash()).orElseThrow();
        assertThat(loaded.id()).isEqualTo(a.id());
        assertThat(loaded.state()).isEqualTo(InvoiceState.UNPAID);
        assertThat(loaded.terms().amountMsat()).isEqualTo(1_000L);
        assertThat(loaded.terms().paymentSecret()).isEqualTo(SECRET);
        assertThat(loaded.terms().minFinalCltvExpiry()).isEqualTo(18);
        assertThat(loaded.terms().minCltv()).isNull();
        assertThat(loaded.createdAt()).isEqualTo(T0);
        assertThat(loaded.revealedPreimage()).isEmpty();
        assertThat(store.findByPaymentHash(b.paymentHash()).orElseThrow().terms().anyAmount()).isTrue();
    }

    @Test
    void rejectedHtlcOfCancelledInvoiceIsStored() {
        HoldInvoice inv = newInvoice(Preimage.random(), 1_000L, T0);
        store.create(inv);
        inv.cancel();
        store.save(inv);

        inv.addRejectedHtlc(new HtlcKey("103x1x0", 7), 1_000, 500, T0.plusSeconds(3));
        store.save(inv);

        HoldInvoice loaded = store.findByPaymentHash(inv.paymentHash()).orElseThrow();
        assertThat(loaded.state()).isEqualTo(InvoiceState.CANCELLED);
        assertThat(loaded.htlcs()).singleElement().satisfies(h -> {
            assertThat(h.id()).isNotNull();
            assertThat(h.state()).isEqualTo(HtlcState.CANCELLED);
            assertThat(h.key()).isEqualTo(new HtlcKey("103x1x0", 7));
        });
        assertThat(store.findWithLiveHtlcs()).isEmpty();
    }

    @Test
    void duplicatePaymentHashIsRejected() {
        Preimage p = Preimage.random();
        store.create(newInvoice(p, 1_000L, T0));

        assertThatThrownBy(() -> store.create(newInvoice(p, 1_000L, T0)))
                .isInstanceOf(InvoiceStoreException.class);
        assertThat(store.findAll()).hasSize(1);
    }

    @Test
    void saveWritesStateAndHtlcsAndAssignsHtlcIds() {
        Preimage p = Preimage.random();
        HoldInvoice inv = newInvoice(p, 1_000L, T0);
        store.create(inv);

        inv.addHtlc(new HtlcKey("103x1x0", 1), 600, 500, T0.plusSeconds(1));
        inv.addHtlc(new HtlcKey("103x1x0", 2), 400, 510, T0.plusSeconds(2));
        inv.accept(T0.plusSeconds(2));
        store.save(inv);

        assertThat(inv.htlcs()).allSatisfy(h -> assertThat(h.id()).isNotNull());

        inv.settle(p, T0.plusSeconds(5));
        store.save(inv);

        HoldInvoice loaded = store.findByPaymentHash(inv.paymentHash()).orElseThrow();
        assertThat(loaded.state()).isEqualTo(InvoiceState.PAID);
        assertThat(loaded.acceptedAt()).isEqualTo(T0.plusSeconds(2));
        assertThat(loaded.settledAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(loaded.revealedPreimage()).contains(p);
        assertThat(loaded.htlcs())
                .extracting(Htlc::state)
                .containsExactly(HtlcState.PAID, HtlcState.PAID);
        assertThat(loaded.htlcs())
                .extracting(Htlc::id)
                .containsExactlyElementsOf(inv.htlcs().stream().map(Htlc::id).toList());
        assertThat(loaded.amountPaidMsat()).isEqualTo(1_000L);
    }

    @Test
    void findWithLiveHtlcsSkipsSettledAndEmptyInvoices() {
        HoldInvoice empty = newInvoice(Preimage.random(), 1_000L, T0);
        HoldInvoice live = newInvoice(Preimage.random(), 1_000L, T0);
        store.create(empty);
        store.create(live);

        live.addHtlc(new HtlcKey("103x1x0", 1), 500, 500, T0);
        store.save(live);

        assertThat(store.findWithLiveHtlcs())
                .extracting(HoldInvoice::paymentHash)
                .containsExactly(live.paymentHash());

        live.failHtlc(new HtlcKey("103x1x0", 1));
        store.save(live);

        assertThat(store.findWithLiveHtlcs()).isEmpty();
    }

    @Test
    void pagesAreOrderedById() {
        for (int i = 0; i < 5; i++) {
            store.create(newInvoice(Preimage.random(), 1_000L, T0));
        }
        List<HoldInvoice> all = store.findAll();

        List<HoldInvoice> page = store.findPage(all.get(1).id(), 2);

        assertThat(page).extracting(HoldInvoice::id)
                .containsExactly(all.get(1).id(), all.get(2).id());
        assertThat(store.findPage(all.get(4).id() + 1, 10)).isEmpty();
    }

    @Test
    void deletesOnlyCancelledInvoicesUpToCutoffWithTheirHtlcs() {
        HoldInvoice old = newInvoice(Preimage.random(), 1_000L, T0);
        HoldInvoice recent = newInvoice(Preimage.random(), 1_000L, T0.plusSeconds(100));
        HoldInvoice open = newInvoice(Preimage.random(), 1_000L, T0);
        store.create(old);
        store.create(recent);
        store.create(open);

        old.addHtlc(new HtlcKey("103x1x0", 1), 500, 500, T0);
        old.cancel();
        store.save(old);
        recent.cancel();
        store.save(recent);

        assertThat(store.deleteCancelledCreatedBefore(T0)).isEqualTo(1);
        assertThat(store.findByPaymentHash(old.paymentHash())).isEmpty();
        assertThat(store.findByPaymentHash(recent.paymentHash())).isPresent();

        assertThat(store.deleteCancelledCreatedBefore(T0.plusSeconds(100))).isEqualTo(1);
        assertThat(store.findAll()).extracting(HoldInvoice::paymentHash).containsExactly(open.paymentHash());
    }

    @Test
    void removedIdsAreNotReused() {
        HoldInvoice first = newInvoice(Preimage.random(), 1_000L, T0);
        store.create(first);
        first.cancel();
        store.save(first);
        store.deleteCancelledCreatedBefore(T0);

        HoldInvoice next = newInvoice(Preimage.random(), 1_000L, T0);
        store.create(next);

        assertThat(next.id()).isGreaterThan(first.id());
    }

    @Test
    void minCltvOverrideIsStored() {
        Preimage p = Preimage.random();
        InvoiceTerms terms = new InvoiceTerms(p.paymentHash(), null, "lnbcrtinjected" + p.paymentHash(), 2_000L,
                SECRET, null, "ab".repeat(32), 3600, 18, 144);
        store.create(HoldInvoice.create(terms, T0));

        InvoiceTerms loaded = store.findByPaymentHash(p.paymentHash()).orElseThrow().terms();

        assertThat(loaded.minCltv()).isEqualTo(144);
        assertThat(loaded.requiredCltvDelta()).isEqualTo(144);
        assertThat(loaded.descriptionHash()).isEqualTo("ab".repeat(32));
        assertThat(loaded.memo()).isNull();
    }

    private static HoldInvoice newInvoice(Preimage preimage, Long amountMsat, Instant createdAt) {
        InvoiceTerms terms = new InvoiceTerms(preimage.paymentHash(), null, "lnbcrt" + preimage.paymentHash(),
                amountMsat, SECRET, "test", null, 3600, 18, null);
        return HoldInvoice.create(terms, createdAt);
    }
}
