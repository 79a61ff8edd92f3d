package com.hold.domain.invoice;

import java.util.Objects;

/**
 * Identity of an HTLC on the host node: channel short id plus the HTLC id within that channel.
 */
public record HtlcKey(String scid, long channelId) {
    public HtlcKey {
        Objects.requireNonNull(scid, "scid");
        if (scid.isBlank()) throw new IllegalArgumentException("scid is blank");
        if (channelId < 0) throw new IllegalArgumentException("channelId must be >= 0");
    }

    @Override
    public String toString() {
        return scid + "/" + channelId;
    }
}
