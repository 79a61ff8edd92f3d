package com.hold.application.service;

import com.hold.application.hook.FailureMessage;
import com.hold.application.hook.HookDecision;
import com.hold.application.ports.RoutingHint;
import com.hold.application.support.Engine;
import com.hold.application.support.FakeInvoiceCodec;
import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.HtlcState;
import com.hold.domain.invoice.InvoiceState;
import com.hold.domain.invoice.PaymentHash;
import com.hold.domain.invoice.Preimage;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HoldInvoiceServiceTest {

    private final Engine engine = new Engine();
    private final Preimage preimage = Preimage.random();
    private final PaymentHash hash = preimage.paymentHash();

    @Test
    void invoiceStoresUnpaidInvoiceWithDefaults() {
        String bolt11 = engine.invoice(preimage, 10_000L);

        HoldInvoice inv = engine.load(hash);
        assertThat(bolt11).startsWith("lnbcrtfake");
        assertThat(inv.bolt11()).isEqualTo(bolt11);
        assertThat(inv.state()).isEqualTo(InvoiceState.UNPAID);
        assertThat(inv.terms().expirySeconds()).isEqualTo(3600);
        assertThat(inv.terms().minFinalCltvExpiry()).isEqualTo(80);
        assertThat(inv.terms().paymentSecret()).isEqualTo(FakeInvoiceCodec.SECRET);
        assertThat(inv.id()).isEqualTo(1L);
    }

    @Test
    void duplicatePaymentHashIsRefused() {
        engine.invoice(preimage, 1L);

        assertThatThrownBy(() -> engine.invoice(preimage, 1L))
                .isInstanceOf(DuplicateInvoiceException.class);
    }

    @Test
    void invoiceWithPreimageKeepsItHiddenUntilPaid() {
        engine.service.invoice(new CreateInvoiceCommand(null, preimage, 1_000L, null, "ab".repeat(32),
                120L, 40, List.of()));
        HoldInvoice inv = engine.load(hash);

        assertThat(inv.preimage()).isEqualTo(preimage);
        assertThat(inv.revealedPreimage()).isEmpty();
        assertThat(inv.terms().descriptionHash()).isEqualTo("ab".repeat(32));
    }

    @Test
    void memoAndDescriptionHashTogetherAreRefused() {
        assertThatThrownBy(() -> engine.service.invoice(new CreateInvoiceCommand(hash, null, 1L, "memo",
                "ab".repeat(32), null, null, null)))
                .isInstanceOf(InvalidInvoiceException.class)
                .hasMessageContaining("mutually exclusive");
    }

    @Test
    void settleResolvesEveryHeldHtlc() {
        engine.invoice(preimage, 2_000L);
        var a = (HookDecision.Hold) engine.pay(hash, 1_000);
        var b = (HookDecision.Hold) engine.pay(hash, 1_000);

        engine.service.settle(preimage);

        assertThat(a.resolution()).isCompletedWithValue(HookDecision.resolve(preimage));
        assertThat(b.resolution()).isCompletedWithValue(HookDecision.resolve(preimage));
        HoldInvoice inv = engine.load(hash);
        assertThat(inv.state()).isEqualTo(InvoiceState.PAID);
        assertThat(inv.settledAt()).isNotNull();
        assertThat(inv.revealedPreimage()).contains(preimage);
        assertThat(inv.htlcs()).allMatch(h -> h.state() == HtlcState.PAID);
    }

    @Test
    void settleWithoutHtlcsFails() {
        engine.invoice(preimage, 2_000L);

        assertThatThrownBy(() -> engine.service.settle(preimage))
                .isInstanceOf(NoHtlcsToSettleException.class)
                .hasMessage("could not settle invoice: no HTLCs to settle");
    }

    @Test
    void settleOfPartiallyPaidInvoiceFails() {
        engine.invoice(preimage, 2_000L);
        engine.pay(hash, 1_000);

        assertThatThrownBy(() -> engine.service.settle(preimage))
                .isInstanceOf(NoHtlcsToSettleException.class);
    }

    @Test
    void settleTwiceIsNoOp() {
        engine.invoice(preimage, 1_000L);
        engine.pay(hash, 1_000);
        engine.service.settle(preimage);
        long seq = engine.bus.currentSequence();

        engine.service.settle(preimage);

        assertThat(engine.bus.currentSequence()).isEqualTo(seq);
        assertThat(engine.load(hash).state()).isEqualTo(InvoiceState.PAID);
    }

    @Test
    void settleUnknownInvoiceFails() {
        assertThatThrownBy(() -> engine.service.settle(Preimage.random()))
                .isInstanceOf(InvoiceNotFoundException.class);
    }

    @Test
    void cancelFailsHeldHtlcs() {
        engine.invoice(preimage, 1_000L);
        var held = (HookDecision.Hold) engine.pay(hash, 1_000);

        engine.service.cancel(hash);

        assertThat(held.resolution())
                .isCompletedWithValue(HookDecision.fail(FailureMessage.INCORRECT_PAYMENT_DETAILS));
        HoldInvoice inv = engine.load(hash);
        assertThat(inv.state()).isEqualTo(InvoiceState.CANCELLED);
        assertThat(inv.htlcs()).allMatch(h -> h.state() == HtlcState.CANCELLED);
    }

    @Test
    void cancelIsIdempotentButRefusedWhenPaid() {
        Preimage other = Preimage.random();
        engine.invoice(preimage, 1_000L);
        engine.invoice(other, 1_000L);
        engine.service.cancel(hash);
        engine.service.cancel(hash);

        engine.pay(other.paymentHash(), 1_000);
        engine.service.settle(other);

        assertThat(engine.load(hash).state()).isEqualTo(InvoiceState.CANCELLED);
        assertThatThrownBy(() -> engine.service.cancel(other.paymentHash()))
                .isInstanceOf(InvoiceStateFinalException.class)
                .hasMessage("could not cancel invoice: state paid is final");
        assertThatThrownBy(() -> engine.service.settle(preimage))
                .isInstanceOf(InvoiceStateFinalException.class)
                .hasMessage("could not settle invoice: state cancelled is final");
    }

    @Test
    void listSupportsHashBolt11AndPagination() {
        Preimage p1 = Preimage.random();
        Preimage p2 = Preimage.random();
        Preimage p3 = Preimage.random();
        engine.invoice(p1, 1L);
        String second = engine.invoice(p2, 2L);
        engine.invoice(p3, 3L);

        assertThat(engine.service.list(ListQuery.all())).extracting(HoldInvoice::id).containsExactly(1L, 2L, 3L);
        assertThat(engine.service.list(ListQuery.page(0, 2))).extracting(HoldInvoice::id).containsExactly(1L, 2L);
        assertThat(engine.service.list(ListQuery.page(2, 10))).extracting(HoldInvoice::id).containsExactly(2L, 3L);
        assertThat(engine.service.list(ListQuery.byPaymentHash(p3.paymentHash())))
                .extracting(HoldInvoice::id).containsExactly(3L);
        assertThat(engine.service.list(new ListQuery(null, second, null)))
                .extracting(HoldInvoice::id).containsExactly(2L);
        assertThat(engine.service.list(ListQuery.byPaymentHash(Preimage.random().paymentHash()))).isEmpty();
    }

    @Test
    void listRejectsConflictingSelectors() {
        assertThatThrownBy(() -> new ListQuery(hash, "lnbc1", null))
                .isInstanceOf(InvalidInvoiceException.class);
    }

    @Test
    void cleanRemovesOnlyOldCancelledInvoices() {
        Preimage unpaid = Preimage.random();
        Preimage accepted = Preimage.random();
        Preimage paid = Preimage.random();
        Preimage cancelled = Preimage.random();
        engine.invoice(unpaid, 1_000L);
        engine.invoice(accepted, 1_000L);
        engine.invoice(paid, 1_000L);
        engine.invoice(cancelled, 1_000L);
        engine.pay(accepted.paymentHash(), 1_000);
        engine.pay(paid.paymentHash(), 1_000);
        engine.service.settle(paid);
        engine.service.cancel(cancelled.paymentHash());

        engine.clock.advance(Duration.ofSeconds(10));
        assertThat(engine.service.clean(60L)).isZero();
        assertThat(engine.service.clean(0L)).isEqualTo(1);

        assertThat(engine.service.list(ListQuery.byPaymentHash(cancelled.paymentHash()))).isEmpty();
        assertThat(engine.service.list(ListQuery.all())).hasSize(3);
    }

    @Test
    void injectTracksInvoiceRoutedThroughUs() {
        RoutingHint hint = new RoutingHint(List.of(
                new RoutingHint.Hop(FakeInvoiceCodec.NODE_ID, 123L, 1, 10, 18)));
        String bolt11 = engine.codec.external(hash, 5_000, FakeInvoiceCodec.OTHER_NODE, List.of(hint));

        engine.service.inject(bolt11, 2);

        HoldInvoice inv = engine.load(hash);
        assertThat(inv.bolt11()).isEqualTo(bolt11);
        assertThat(inv.terms().amountMsat()).isEqualTo(5_000);
        assertThat(inv.terms().requiredCltvDelta()).isEqualTo(2);
        assertThat(inv.state()).isEqualTo(InvoiceState.UNPAID);
    }

    @Test
    void injectRefusesForeignInvoice() {
        String bolt11 = engine.codec.external(hash, 5_000, FakeInvoiceCodec.OTHER_NODE, List.of());

        assertThatThrownBy(() -> engine.service.inject(bolt11, null))
                .isInstanceOf(InvalidInvoiceException.class)
                .hasMessage("invoice is not related to us");
        assertThatThrownBy(() -> engine.service.inject("garbage", null))
                .isInstanceOf(InvalidInvoiceException.class)
                .hasMessageStartingWith("could not decode invoice");
    }

    @Test
    void getInfoReportsVersionAndNode() {
        assertThat(engine.service.getInfo()).isEqualTo(new NodeInfo("test", FakeInvoiceCodec.NODE_ID));
    }
}
