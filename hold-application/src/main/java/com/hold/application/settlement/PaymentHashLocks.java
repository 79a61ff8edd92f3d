package com.hold.application.settlement;

import com.hold.domain.invoice.PaymentHash;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Keyed lock table: one writer per payment hash, full parallelism across hashes.
 * Entries are dropped once nobody holds or waits for them.
 */
public final class PaymentHashLocks {

    private final Map<PaymentHash, Entry> locks = new HashMap<>();

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    public <T> T withLock(PaymentHash hash, Supplier<T> action) {
        Entry e;
        synchronized (locks) {
            e = locks.computeIfAbsent(hash, k -> new Entry());
            e.users++;
        }
        e.lock.lock();
        try {
            return action.get();
        } finally {
            e.lock.unlock();
            synchronized (locks) {
                if (--e.users == 0) {
                    locks.remove(hash);
                }
            }
        }
    }

    public void withLock(PaymentHash hash, Runnable action) {
        withLock(hash, () -> {
            action.run();
            return null;
        });
    }

    /** Number of hashes currently locked or waited on. */
    public int activeKeys() {
        synchronized (locks) {
            return locks.size();
        }
    }
}
