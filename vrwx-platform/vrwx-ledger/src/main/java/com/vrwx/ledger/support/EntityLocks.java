package com.vrwx.ledger.support;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-entity reentrant locks. Components acquire across entities in the order
 * offer, dispute, job, bond, stake; token balances are always innermost.
 *
 * Locks are never evicted. They live as long as the in-memory entity maps they guard.
 */
public final class EntityLocks<K> {

    private final Map<K, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(K key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(K key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }
}
