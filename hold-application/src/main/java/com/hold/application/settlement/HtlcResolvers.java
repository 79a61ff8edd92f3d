package com.hold.application.settlement;

import com.hold.application.hook.HookDecision;
import com.hold.domain.invoice.HtlcKey;
import com.hold.domain.invoice.PaymentHash;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Pending answers for held HTLCs, one future per HTLC the host is waiting on.
 */
public final class HtlcResolvers {

    private final Map<PaymentHash, Map<HtlcKey, CompletableFuture<HookDecision>>> pending = new HashMap<>();

    /**
     * Returns the future the host's hook call waits on. A redelivered HTLC that is still
     * pending gets the same future.
     */
    public CompletableFuture<HookDecision> register(PaymentHash hash, HtlcKey key) {
        CompletableFuture<HookDecision> future;
        synchronized (this) {
            Map<HtlcKey, CompletableFuture<HookDecision>> byKey =
                    pending.computeIfAbsent(hash, h -> new HashMap<>());
            CompletableFuture<HookDecision> existing = byKey.get(key);
            if (existing != null && !existing.isDone()) {
                return existing;
            }
            future = new CompletableFuture<>();
            byKey.put(key, future);
        }
        // the host may give up on the call; forget the future then
        future.whenComplete((r, e) -> forget(hash, key, future));
        return future;
    }

    /**
     * Completes the pending future for the HTLC, if any.
     *
     * @return false when nobody was waiting
     */
    public boolean resolve(PaymentHash hash, HtlcKey key, HookDecision decision) {
        if (decision == null || !decision.isTerminal()) {
            throw new IllegalArgumentException("cannot resolve with " + decision);
        }
        CompletableFuture<HookDecision> future;
        synchronized (this) {
            Map<HtlcKey, CompletableFuture<HookDecision>> byKey = pending.get(hash);
            if (byKey == null) return false;
            future = byKey.remove(key);
            if (byKey.isEmpty()) pending.remove(hash);
        }
        return future != null && future.complete(decision);
    }

    public synchronized int pendingCount(PaymentHash hash) {
        Map<HtlcKey, CompletableFuture<HookDecision>> byKey = pending.get(hash);
        return byKey == null ? 0 : byKey.size();
    }

    public synchronized int pendingCount() {
        return pending.values().stream().mapToInt(Map::size).sum();
    }

    private synchronized void forget(PaymentHash hash, HtlcKey key, CompletableFuture<HookDecision> future) {
        Map<HtlcKey, CompletableFuture<HookDecision>> byKey = pending.get(hash);
        if (byKey == null) return;
        byKey.remove(key, future);
        if (byKey.isEmpty()) pending.remove(hash);
    }
}
