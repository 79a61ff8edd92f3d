package com.hold.domain.invoice;

import java.time.Instant;
import java.util.Objects;

public record Htlc(
        Long id,
        HtlcKey key,
        long msat,
        long cltvExpiry,
        HtlcState state,
        Instant createdAt
) {
    public Htlc {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");
        if (msat <= 0) throw new IllegalArgumentException("msat must be > 0");
        if (cltvExpiry < 0) throw new IllegalArgumentException("cltvExpiry must be >= 0");
    }

    public static Htlc accepted(HtlcKey key, long msat, long cltvExpiry, Instant now) {
        return new Htlc(null, key, msat, cltvExpiry, HtlcState.ACCEPTED, now);
    }

    public static Htlc rejected(HtlcKey key, long msat, long cltvExpiry, Instant now) {
        return new Htlc(null, key, msat, cltvExpiry, HtlcState.CANCELLED, now);
    }

    public boolean isLive() {
        return state == HtlcState.ACCEPTED;
    }

    public Htlc withState(HtlcState next) {
        return new Htlc(id, key, msat, cltvExpiry, next, createdAt);
    }

    public Htlc withId(long newId) {
        return new Htlc(newId, key, msat, cltvExpiry, state, createdAt);
    }
}
