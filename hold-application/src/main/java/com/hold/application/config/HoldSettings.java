package com.hold.application.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Engine policy knobs.
 *
 * @param overpaymentFactor     an invoice accepts HTLCs up to {@code factor * amount}
 * @param expiryDeadlineBlocks  HTLCs this close to their CLTV expiry are failed, 0 disables the watchdog
 * @param subscriberBuffer      events a single subscriber may lag behind before it is dropped
 */
public record HoldSettings(
        double overpaymentFactor,
        Duration mppTimeout,
        long expiryDeadlineBlocks,
        long defaultExpirySeconds,
        int defaultMinFinalCltvExpiry,
        int subscriberBuffer
) {
    public static final double DEFAULT_OVERPAYMENT_FACTOR = 2.0;
    public static final Duration DEFAULT_MPP_TIMEOUT = Duration.ofSeconds(60);
    public static final long DEFAULT_EXPIRY_DEADLINE = 2;
    public static final long DEFAULT_EXPIRY_SECONDS = 3600;
    public static final int DEFAULT_MIN_FINAL_CLTV_EXPIRY = 80;
    public static final int DEFAULT_SUBSCRIBER_BUFFER = 1024;

    public HoldSettings {
        Objects.requireNonNull(mppTimeout, "mppTimeout");
        if (overpaymentFactor < 1.0) {
            throw new IllegalArgumentException("overpaymentFactor must be >= 1, got " + overpaymentFactor);
        }
        if (mppTimeout.isNegative() || mppTimeout.isZero()) {
            throw new IllegalArgumentException("mppTimeout must be positive");
        }
        if (expiryDeadlineBlocks < 0) {
            throw new IllegalArgumentException("expiryDeadlineBlocks must be >= 0");
        }
        if (defaultExpirySeconds <= 0) throw new IllegalArgumentException("defaultExpirySeconds must be > 0");
        if (defaultMinFinalCltvExpiry < 0) throw new IllegalArgumentException("defaultMinFinalCltvExpiry must be >= 0");
        if (subscriberBuffer <= 0) throw new IllegalArgumentException("subscriberBuffer must be > 0");
    }

    public static HoldSettings defaults() {
        return new HoldSettings(
                DEFAULT_OVERPAYMENT_FACTOR,
                DEFAULT_MPP_TIMEOUT,
                DEFAULT_EXPIRY_DEADLINE,
                DEFAULT_EXPIRY_SECONDS,
                DEFAULT_MIN_FINAL_CLTV_EXPIRY,
                DEFAULT_SUBSCRIBER_BUFFER
        );
    }

    public boolean watchdogEnabled() {
        return expiryDeadlineBlocks > 0;
    }
}
