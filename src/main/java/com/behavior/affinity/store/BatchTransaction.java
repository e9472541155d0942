package com.behavior.affinity.store;

import com.behavior.affinity.core.model.AffinityKey;
import com.behavior.affinity.core.model.AffinityRecord;
import com.behavior.affinity.exception.BatchFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Compensating transaction spanning every affinity write of one batch run.
 *
 * <p>Before a key is written, the transaction registers how to undo the write:
 * restore the record as it was, or delete it if it did not exist. If any write
 * fails, or the transaction is closed without {@link #markSuccess()}, the
 * registered compensations run in reverse order.</p>
 *
 * <pre>
 * try (BatchTransaction tx = new BatchTransaction(runId, store)) {
 *     tx.write(key, prior, () -> {
 *         store.upsert(key, raw, interest, lastEventTime);
 *         store.upsertDecision(key, ...);
 *     });
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class BatchTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchTransaction.class);

    private final String runId;
    private final AffinityStore store;
    private final Deque<Compensation> compensations = new ArrayDeque<>();
    private int writes;
    private boolean success = false;
    private boolean closed = false;

    public BatchTransaction(String runId, AffinityStore store) {
        this.runId = Objects.requireNonNull(runId, "runId is required");
        this.store = Objects.requireNonNull(store, "store is required");
    }

    /**
     * Writes one key. The compensation is registered before the operation runs
     * so a write that fails halfway is reverted too.
     *
     * @param key       the key being written
     * @param prior     the record as read before the write, or null if absent
     * @param operation the writes for this key
     * @throws BatchFailureException if the operation fails, after all compensations ran
     */
    public void write(AffinityKey key, AffinityRecord prior, Runnable operation) {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
        Runnable undo = prior != null ? () -> store.restore(prior) : () -> store.delete(key);
        compensations.push(new Compensation(key, undo));

        try {
            operation.run();
            writes++;
        } catch (RuntimeException e) {
            log.warn("batch.writeFailed runId={} key={} error={}", runId, key, e.getMessage());
            throw abort(e);
        }
    }

    /**
     * Reverts every write made so far and closes the transaction. Used when a
     * step between writes fails, such as reading a prior record.
     *
     * @return the exception to throw, carrying the number of reverted keys
     */
    public BatchFailureException abort(Throwable cause) {
        int reverted = rollback();
        closed = true;
        return new BatchFailureException(runId, reverted, cause);
    }

    /**
     * Marks the transaction as successful; close() will then keep all writes.
     */
    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Number of keys written successfully so far.
     */
    public int getWrites() {
        return writes;
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("batch.closedWithoutSuccess runId={} - rolling back {} writes", runId, compensations.size());
            rollback();
        }
        closed = true;
    }

    private int rollback() {
        int reverted = 0;
        while (!compensations.isEmpty()) {
            Compensation compensation = compensations.pop();
            try {
                compensation.undo().run();
                reverted++;
            } catch (RuntimeException e) {
                // keep going: remaining keys can still be reverted
                log.error("batch.compensationFailed runId={} key={} error={}",
                        runId, compensation.key(), e.getMessage());
            }
        }
        log.info("batch.rolledBack runId={} reverted={}", runId, reverted);
        return reverted;
    }

    private record Compensation(AffinityKey key, Runnable undo) {}
}
