package com.hold.api.metrics;

import com.hold.application.events.InvoiceEventBus;
import com.hold.application.hook.FailureMessage;
import com.hold.application.telemetry.EngineObserver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Engine metrics.
 *
 * Exposes:
 * - hold.htlcs.accepted / hold.htlcs.rejected (tagged by failure code)
 * - hold.invoices.settled / hold.invoices.cancelled
 * - hold.htlcs.expired / hold.htlcs.mpp_timeout
 * - hold.events.subscribers (gauge)
 */
@Component
public class HoldMetrics implements EngineObserver {

  private final MeterRegistry registry;
  private final Counter accepted;
  private final Counter settled;
  private final Counter cancelled;
  private final Counter expired;
  private final Counter timedOut;

  public HoldMetrics(MeterRegistry registry, InvoiceEventBus bus) {
    this.registry = registry;

    registry.gauge("hold.events.subscribers", bus, InvoiceEventBus::subscriberCount);

    this.accepted = Counter.builder("hold.htlcs.accepted")
        .description("HTLCs held for an invoice")
        .register(registry);
    this.settled = Counter.builder("hold.invoices.settled")
        .description("Invoices settled with their preimage")
        .register(registry);
    this.cancelled = Counter.builder("hold.invoices.cancelled")
        .description("Invoices cancelled")
        .register(registry);
    this.expired = Counter.builder("hold.htlcs.expired")
        .description("HTLCs failed by the expiry watchdog")
        .register(registry);
    this.timedOut = Counter.builder("hold.htlcs.mpp_timeout")
        .description("HTLCs failed because the multi-part payment did not complete in time")
        .register(registry);
  }

  @Override
  public void htlcAccepted(long msat) {
    accepted.increment();
  }

  @Override
  public void htlcRejected(FailureMessage reason) {
    Counter.builder("hold.htlcs.rejected")
        .description("HTLCs failed on arrival")
        .tag("code", reason.code())
        .register(registry)
        .increment();
  }

  @Override
  public void invoiceSettled(int htlcCount) {
    settled.increment();
  }

  @Override
  public void invoiceCancelled(int htlcCount) {
    cancelled.increment();
  }

  @Override
  public void htlcsExpired(int count) {
    expired.increment(count);
  }

  @Override
  public void htlcsTimedOut(int count) {
    timedOut.increment(count);
  }
}
