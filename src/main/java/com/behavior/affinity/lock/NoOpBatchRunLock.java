package com.behavior.affinity.lock;

/**
 * Lock that never blocks, for callers that already serialize batch runs
 * (for example a single scheduler instance).
 */
public class NoOpBatchRunLock implements BatchRunLock {

    @Override
    public void lock(String tenantId) {
    }

    @Override
    public void unlock(String tenantId) {
    }
}
