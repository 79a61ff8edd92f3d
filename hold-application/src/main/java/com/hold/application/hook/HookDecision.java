package com.hold.application.hook;

import com.hold.domain.invoice.Preimage;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Answer to the host node for one incoming HTLC.
 *
 * {@link Hold} is the only non-terminal answer: its future completes with one of
 * the other three once the invoice is settled, cancelled or the HTLC is expired.
 */
public interface HookDecision {

    HookDecision CONTINUE = new Continue();

    record Continue() implements HookDecision {}

    record Fail(FailureMessage message) implements HookDecision {
        public Fail {
            Objects.requireNonNull(message, "message");
        }
    }

    record Resolve(Preimage preimage) implements HookDecision {
        public Resolve {
            Objects.requireNonNull(preimage, "preimage");
        }
    }

    record Hold(CompletableFuture<HookDecision> resolution) implements HookDecision {
        public Hold {
            Objects.requireNonNull(resolution, "resolution");
        }
    }

    static HookDecision fail(FailureMessage message) {
        return new Fail(message);
    }

    static HookDecision resolve(Preimage preimage) {
        return new Resolve(preimage);
    }

    static HookDecision hold(CompletableFuture<HookDecision> resolution) {
        return new Hold(resolution);
    }

    default boolean isTerminal() {
        return !(this instanceof Hold);
    }
}
