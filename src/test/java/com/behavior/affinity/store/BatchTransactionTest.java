package com.behavior.affinity.store;

import com.behavior.affinity.core.model.AffinityKey;
import com.behavior.affinity.core.model.AffinityRecord;
import com.behavior.affinity.core.model.ScoringContext;
import com.behavior.affinity.exception.BatchFailureException;
import com.behavior.affinity.exception.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the compensating transaction around batch writes.
 */
class BatchTransactionTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private InMemoryAffinityStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryAffinityStore();
    }

    private static AffinityKey key(String subjectId) {
        return AffinityKey.of("t1", "p1", subjectId, ScoringContext.defaults());
    }

    @Test
    void successfulTransaction_keepsAllWrites() {
        try (BatchTransaction tx = new BatchTransaction("run-1", store)) {
            tx.write(key("A"), null, () -> store.upsert(key("A"), 1.0, 0.01, T0));
            tx.write(key("B"), null, () -> store.upsert(key("B"), 2.0, 0.02, T0));
            tx.markSuccess();
            assertEquals(2, tx.getWrites());
        }

        assertEquals(2, store.size());
    }

    @Test
    void failedWrite_restoresPriorAndDeletesNewRecords() {
        store.upsert(key("A"), 10.0, 0.09, T0);
        AffinityRecord priorA = store.get(key("A")).orElseThrow();

        BatchFailureException e = assertThrows(BatchFailureException.class, () -> {
            try (BatchTransaction tx = new BatchTransaction("run-2", store)) {
                tx.write(key("A"), priorA, () -> store.upsert(key("A"), 99.0, 0.49, T0.plusSeconds(60)));
                tx.write(key("B"), null, () -> store.upsert(key("B"), 5.0, 0.04, T0));
                tx.write(key("C"), null, () -> {
                    store.upsert(key("C"), 5.0, 0.04, T0);
                    throw new PersistenceException("decision write failed");
                });
                tx.markSuccess();
            }
        });

        assertEquals("run-2", e.getRunId());
        assertEquals(3, e.getRowsRolledBack());
        assertInstanceOf(PersistenceException.class, e.getCause());
        assertEquals(priorA, store.get(key("A")).orElseThrow());
        assertTrue(store.get(key("B")).isEmpty());
        assertTrue(store.get(key("C")).isEmpty(), "half-written key is reverted too");
    }

    @Test
    void closedWithoutSuccess_revertsEverything() {
        BatchTransaction tx = new BatchTransaction("run-3", store);
        tx.write(key("A"), null, () -> store.upsert(key("A"), 1.0, 0.01, T0));
        tx.close();

        assertEquals(0, store.size());
    }

    @Test
    void abort_revertsAndReturnsFailure() {
        BatchTransaction tx = new BatchTransaction("run-4", store);
        tx.write(key("A"), null, () -> store.upsert(key("A"), 1.0, 0.01, T0));

        BatchFailureException e = tx.abort(new PersistenceException("read failed"));

        assertEquals(1, e.getRowsRolledBack());
        assertEquals(0, store.size());
        assertThrows(IllegalStateException.class, () -> tx.write(key("B"), null, () -> { }));
    }

    @Test
    void failingCompensation_doesNotStopTheOthers() {
        AffinityStore failingStore = mock(AffinityStore.class);
        when(failingStore.delete(key("B"))).thenThrow(new PersistenceException("down"));

        BatchTransaction tx = new BatchTransaction("run-5", failingStore);
        tx.write(key("A"), null, () -> { });
        tx.write(key("B"), null, () -> { });

        BatchFailureException e = tx.abort(new IllegalStateException("boom"));

        assertEquals(1, e.getRowsRolledBack());
        verify(failingStore).delete(key("A"));
        verify(failingStore).delete(key("B"));
        verify(failingStore, never()).restore(any());
    }
}
