package com.behavior.affinity.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LocalBatchRunLockTest {

    @Nested
    @DisplayName("NoOpBatchRunLock")
    class NoOpTests {

        @Test
        @DisplayName("Should lock and unlock without error")
        void testNoOp() {
            NoOpBatchRunLock lock = new NoOpBatchRunLock();
            assertDoesNotThrow(() -> {
                lock.lock("t1");
                lock.lock("t1");
                lock.unlock("t1");
            });
        }
    }

    @Nested
    @DisplayName("LocalBatchRunLock")
    class LocalTests {

        @Test
        @DisplayName("Should allow different tenants concurrently")
        void testDifferentTenants() throws Exception {
            LocalBatchRunLock lock = new LocalBatchRunLock(new LockConfig(Duration.ofMillis(200)));
            lock.lock("t1");
            try {
                CompletableFuture<Void> other = CompletableFuture.runAsync(() -> {
                    lock.lock("t2");
                    lock.unlock("t2");
                });
                assertDoesNotThrow(() -> other.get(5, TimeUnit.SECONDS));
            } finally {
                lock.unlock("t1");
            }
        }

        @Test
        @DisplayName("Should time out while another run holds the tenant")
        void testTimeout() throws Exception {
            LocalBatchRunLock lock = new LocalBatchRunLock(new LockConfig(Duration.ofMillis(100)));
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            Thread holder = new Thread(() -> {
                lock.lock("t1");
                held.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    lock.unlock("t1");
                }
            });
            holder.start();
            assertTrue(held.await(5, TimeUnit.SECONDS));

            try {
                assertThrows(LockAcquisitionException.class, () -> lock.lock("t1"));
            } finally {
                release.countDown();
                holder.join(5000);
            }
        }

        @Test
        @DisplayName("Should acquire once the holder releases")
        void testAcquireAfterRelease() throws ExecutionException, InterruptedException {
            LocalBatchRunLock lock = new LocalBatchRunLock();
            lock.lock("t1");
            lock.unlock("t1");

            CompletableFuture<Void> other = CompletableFuture.runAsync(() -> {
                lock.lock("t1");
                lock.unlock("t1");
            });
            other.get();
            assertTrue(other.isDone());
        }

        @Test
        @DisplayName("Unlock from a thread that does not hold the lock is ignored")
        void testUnlockNotHeld() {
            LocalBatchRunLock lock = new LocalBatchRunLock();
            assertDoesNotThrow(() -> lock.unlock("never-locked"));
        }
    }

    @Test
    void lockConfigRejectsZeroTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new LockConfig(Duration.ZERO));
    }
}
