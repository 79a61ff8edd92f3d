package com.hold.domain.invoice;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HoldInvoiceTest {

    private static final Preimage PREIMAGE = new Preimage("00".repeat(32));
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private static HoldInvoice invoice(Long amountMsat) {
        InvoiceTerms terms = new InvoiceTerms(PREIMAGE.paymentHash(), null, "lnbcrt1test", amountMsat,
                null, "coffee", null, 3600, 80, null);
        return HoldInvoice.create(terms, NOW);
    }

    @Test
    void preimageHashesToPaymentHash() {
        assertThat(PREIMAGE.paymentHash().hex())
                .isEqualTo("66687aadf862bd776c8fc18b8e9f8e20089714856ee233b3902a591d0d5f2925");
    }

    @Test
    void settleMovesLiveHtlcsToPaid() {
        HoldInvoice inv = invoice(1_000L);
        inv.addHtlc(new HtlcKey("1x1x1", 0), 500, 200, NOW);
        inv.addHtlc(new HtlcKey("1x1x2", 0), 500, 200, NOW);
        inv.accept(NOW);

        assertThat(inv.revealedPreimage()).isEmpty();

        var resolved = inv.settle(PREIMAGE, NOW.plusSeconds(5));

        assertThat(resolved).hasSize(2).allMatch(h -> h.state() == HtlcState.PAID);
        assertThat(inv.state()).isEqualTo(InvoiceState.PAID);
        assertThat(inv.settledAt()).isEqualTo(NOW.plusSeconds(5));
        assertThat(inv.revealedPreimage()).contains(PREIMAGE);
        assertThat(inv.amountPaidMsat()).isEqualTo(1_000L);
    }

    @Test
    void settleRejectsWrongPreimage() {
        HoldInvoice inv = invoice(1_000L);
        inv.addHtlc(new HtlcKey("1x1x1", 0), 1_000, 200, NOW);
        inv.accept(NOW);

        assertThatThrownBy(() -> inv.settle(new Preimage("11".repeat(32)), NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(inv.state()).isEqualTo(InvoiceState.ACCEPTED);
    }

    @Test
    void unpaidCannotBeSettled() {
        HoldInvoice inv = invoice(1_000L);

        assertThatThrownBy(() -> inv.settle(PREIMAGE, NOW))
                .isInstanceOf(InvalidInvoiceTransitionException.class);
    }

    @Test
    void finalStatesRejectFurtherTransitions() {
        HoldInvoice inv = invoice(null);
        inv.addHtlc(new HtlcKey("1x1x1", 3), 42, 200, NOW);
        inv.accept(NOW);
        var failed = inv.cancel();

        assertThat(failed).singleElement().extracting(Htlc::state).isEqualTo(HtlcState.CANCELLED);
        assertThat(inv.liveHtlcs()).isEmpty();
        assertThatThrownBy(inv::cancel).isInstanceOf(InvalidInvoiceTransitionException.class);
        assertThatThrownBy(() -> inv.addHtlc(new HtlcKey("1x1x1", 4), 1, 200, NOW))
                .isInstanceOf(InvalidInvoiceTransitionException.class);
    }

    @Test
    void rejectedPartIsKeptCancelledInAnyState() {
        HoldInvoice inv = invoice(1_000L);
        inv.addHtlc(new HtlcKey("1x1x1", 0), 1_000, 200, NOW);
        inv.accept(NOW);
        inv.cancel();

        Htlc rejected = inv.addRejectedHtlc(new HtlcKey("1x1x1", 1), 500, 200, NOW);

        assertThat(rejected.state()).isEqualTo(HtlcState.CANCELLED);
        assertThat(inv.state()).isEqualTo(InvoiceState.CANCELLED);
        assertThat(inv.htlcs()).hasSize(2);
        assertThat(inv.amountPaidMsat()).isZero();
        assertThatThrownBy(() -> inv.addRejectedHtlc(new HtlcKey("1x1x1", 1), 500, 200, NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failingOneHtlcLeavesInvoiceState() {
        HoldInvoice inv = invoice(1_000L);
        HtlcKey a = new HtlcKey("1x1x1", 0);
        inv.addHtlc(a, 400, 200, NOW);
        inv.addHtlc(new HtlcKey("1x1x1", 1), 300, 200, NOW.plusSeconds(1));

        inv.failHtlc(a);

        assertThat(inv.state()).isEqualTo(InvoiceState.UNPAID);
        assertThat(inv.liveAmountMsat()).isEqualTo(300);
        assertThat(inv.latestLiveHtlcAt()).contains(NOW.plusSeconds(1));
    }

    @Test
    void stateOrderIsForwardOnly() {
        assertThat(InvoiceState.UNPAID.canTransitionTo(InvoiceState.ACCEPTED)).isTrue();
        assertThat(InvoiceState.UNPAID.canTransitionTo(InvoiceState.PAID)).isFalse();
        assertThat(InvoiceState.ACCEPTED.canTransitionTo(InvoiceState.UNPAID)).isFalse();
        for (InvoiceState next : InvoiceState.values()) {
            assertThat(InvoiceState.PAID.canTransitionTo(next)).isFalse();
            assertThat(InvoiceState.CANCELLED.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    void memoAndDescriptionHashAreExclusive() {
        assertThatThrownBy(() -> new InvoiceTerms(PREIMAGE.paymentHash(), null, "lnbcrt1x", null, null,
                "memo", "ab".repeat(32), 3600, 80, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
