package org.qbitspark.fileboxstorage.globe_utils;

import com.google.common.util.concurrent.Striped;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Mutual exclusion keyed by an entity id.
 *
 * <p>Callers holding different keys never wait on a shared global lock; at worst two keys hash to
 * the same stripe. Callers must not hold two keys of the same instance at once.
 */
public class KeyedLocks {

    private final Striped<Lock> stripes;

    public KeyedLocks(int stripeCount) {
        this.stripes = Striped.lazyWeakLock(stripeCount);
    }

    public <T> T withLock(Object key, Supplier<T> action) {
        Lock lock = stripes.get(Objects.requireNonNull(key, "lock key"));
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(Object key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }
}
