package com.hold.application.telemetry;

import com.hold.application.hook.FailureMessage;

/**
 * Optional observer for engine telemetry. Keeps the core free of a metrics library.
 */
public interface EngineObserver {

    EngineObserver NOOP = new EngineObserver() {};

    default void htlcAccepted(long msat) {}
    default void htlcRejected(FailureMessage reason) {}
    default void invoiceSettled(int htlcCount) {}
    default void invoiceCancelled(int htlcCount) {}
    default void htlcsExpired(int count) {}
    default void htlcsTimedOut(int count) {}
}
