package com.behavior.affinity.lock;

/**
 * Serializes batch runs that write the same tenant's affinity records.
 */
public interface BatchRunLock {

    /**
     * Blocks until the tenant's lock is held by the calling thread.
     *
     * @throws LockAcquisitionException if the lock is not acquired within the configured timeout
     */
    void lock(String tenantId);

    /**
     * Releases the tenant's lock if the calling thread holds it.
     */
    void unlock(String tenantId);
}
