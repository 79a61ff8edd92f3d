package com.hold.application.expiry;

import com.hold.application.hook.FailureMessage;
import com.hold.application.hook.HookDecision;
import com.hold.application.support.Engine;
import com.hold.domain.invoice.InvoiceState;
import com.hold.domain.invoice.PaymentHash;
import com.hold.domain.invoice.Preimage;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MppTimeoutSweeperTest {

    private final Engine engine = new Engine(Engine.settings(2.0, 2, Duration.ofSeconds(60), 64));
    private final Preimage preimage = Preimage.random();
    private final PaymentHash hash = preimage.paymentHash();

    @Test
    void stalledPartialPaymentIsFailedWithMppTimeout() {
        engine.invoice(preimage, 3_000L);
        var first = (HookDecision.Hold) engine.pay(hash, 1_000);
        engine.clock.advance(Duration.ofSeconds(30));
        var second = (HookDecision.Hold) engine.pay(hash, 1_000);

        engine.clock.advance(Duration.ofSeconds(59));
        assertThat(engine.sweeper.sweep()).isZero();

        engine.clock.advance(Duration.ofSeconds(1));
        assertThat(engine.sweeper.sweep()).isEqualTo(2);

        HookDecision timeout = HookDecision.fail(FailureMessage.MPP_TIMEOUT);
        assertThat(first.resolution()).isCompletedWithValue(timeout);
        assertThat(second.resolution()).isCompletedWithValue(timeout);
        var inv = engine.load(hash);
        assertThat(inv.state()).isEqualTo(InvoiceState.UNPAID);
        assertThat(inv.liveHtlcs()).isEmpty();
        assertThat(inv.amountPaidMsat()).isZero();
    }

    @Test
    void invoiceCanStillBePaidAfterTimeout() {
        engine.invoice(preimage, 1_000L);
        engine.pay(hash, 500);
        engine.clock.advance(Duration.ofMinutes(5));
        engine.sweeper.sweep();

        engine.pay(hash, 1_000);

        assertThat(engine.load(hash).state()).isEqualTo(InvoiceState.ACCEPTED);
    }

    @Test
    void acceptedInvoicesAreNotTimedOut() {
        engine.invoice(preimage, 1_000L);
        var held = (HookDecision.Hold) engine.pay(hash, 1_000);
        engine.clock.advance(Duration.ofHours(1));

        assertThat(engine.sweeper.sweep()).isZero();
        assertThat(held.resolution()).isNotDone();
    }
}
