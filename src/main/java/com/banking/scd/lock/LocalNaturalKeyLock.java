package com.banking.scd.lock;

import com.banking.scd.core.model.DimensionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process lock using one {@link ReentrantLock} per natural key.
 * Suitable for single-JVM deployments; several processes writing the same store
 * rely on the store's conditional writes instead.
 *
 * <p>A lock entry is dropped when its last holder releases it and no thread is queued,
 * so the map only holds keys that are being loaded.</p>
 */
public class LocalNaturalKeyLock implements NaturalKeyLock {
    private static final Logger log = LoggerFactory.getLogger(LocalNaturalKeyLock.class);

    private final ConcurrentHashMap<LockKey, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalNaturalKeyLock() {
        this(LockConfig.defaults());
    }

    public LocalNaturalKeyLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(DimensionId dimension, String naturalKey) {
        LockKey key = new LockKey(dimension, naturalKey);
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
            try {
                if (!lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                    throw new LockAcquisitionException(
                            "Failed to acquire lock for " + key + " within " + config.timeoutMs() + "ms");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockAcquisitionException("Interrupted while acquiring lock for " + key, e);
            }
            // the entry may have been dropped between computeIfAbsent and tryLock
            if (locks.get(key) == lock) {
                log.debug("Lock acquired: {}", key);
                return;
            }
            lock.unlock();
        }
    }

    @Override
    public void unlock(DimensionId dimension, String naturalKey) {
        LockKey key = new LockKey(dimension, naturalKey);
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            if (lock.getHoldCount() == 1 && !lock.hasQueuedThreads()) {
                locks.remove(key, lock);
            }
            lock.unlock();
            log.debug("Lock released: {}", key);
        }
    }

    /**
     * Number of natural keys currently holding a lock entry.
     */
    public int size() {
        return locks.size();
    }

    private record LockKey(DimensionId dimension, String naturalKey) {
        @Override
        public String toString() {
            return dimension + "/" + naturalKey;
        }
    }
}
