package com.behavior.affinity.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process lock per tenant using {@link ReentrantLock}.
 * Suitable for single-JVM deployments; this is the default.
 */
public class LocalBatchRunLock implements BatchRunLock {
    private static final Logger log = LoggerFactory.getLogger(LocalBatchRunLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalBatchRunLock() {
        this(LockConfig.defaults());
    }

    public LocalBatchRunLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(String tenantId) {
        ReentrantLock lock = locks.computeIfAbsent(tenantId, k -> new ReentrantLock());
        try {
            if (!lock.tryLock(config.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException("Batch run for tenant '" + tenantId
                        + "' still in progress after " + config.timeout().toMillis() + "ms");
            }
            log.debug("Batch lock acquired: {}", tenantId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while waiting for batch lock of tenant " + tenantId, e);
        }
    }

    @Override
    public void unlock(String tenantId) {
        ReentrantLock lock = locks.get(tenantId);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("Batch lock released: {}", tenantId);
        }
    }
}
