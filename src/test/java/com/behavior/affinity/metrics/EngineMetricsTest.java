package com.behavior.affinity.metrics;

import com.behavior.affinity.decision.RecommendedAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EngineMetrics Tests")
class EngineMetricsTest {

    @Nested
    @DisplayName("NoOpEngineMetrics")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpEngineMetrics noOp = new NoOpEngineMetrics();

            assertDoesNotThrow(() -> {
                noOp.recordBatchDuration(Duration.ofMillis(100), true);
                noOp.incrementRowsScored(3);
                noOp.incrementReplaysSkipped(1);
                noOp.incrementGcDeleted(10);
                noOp.incrementDecision(RecommendedAction.WAIT);
                noOp.recordInterestScore(0.5);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerEngineMetrics")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerEngineMetrics metrics = new MicrometerEngineMetrics(registry);

        @Test
        @DisplayName("Should record batch duration per outcome")
        void recordBatchDuration() {
            metrics.recordBatchDuration(Duration.ofMillis(150), true);
            metrics.recordBatchDuration(Duration.ofMillis(250), true);
            metrics.recordBatchDuration(Duration.ofMillis(50), false);

            Timer success = registry.find("affinity.batch.duration").tag("outcome", "success").timer();
            Timer failure = registry.find("affinity.batch.duration").tag("outcome", "failure").timer();

            assertNotNull(success);
            assertEquals(2, success.count());
            assertNotNull(failure);
            assertEquals(1, failure.count());
        }

        @Test
        @DisplayName("Should count rows, replays and GC deletions")
        void counters() {
            metrics.incrementRowsScored(4);
            metrics.incrementReplaysSkipped(2);
            metrics.incrementGcDeleted(7L);

            assertEquals(4.0, registry.find("affinity.rows.scored").counter().count());
            assertEquals(2.0, registry.find("affinity.replays.skipped").counter().count());
            assertEquals(7.0, registry.find("affinity.gc.deleted").counter().count());
        }

        @Test
        @DisplayName("Should count decisions per action")
        void decisionsPerAction() {
            metrics.incrementDecision(RecommendedAction.STRONG_BUY_ALERT);
            metrics.incrementDecision(RecommendedAction.STRONG_BUY_ALERT);
            metrics.incrementDecision(RecommendedAction.WAIT);

            Counter alerts = registry.find("affinity.decision").tag("action", "STRONG_BUY_ALERT").counter();
            Counter waits = registry.find("affinity.decision").tag("action", "WAIT").counter();

            assertEquals(2.0, alerts.count());
            assertEquals(1.0, waits.count());
        }

        @Test
        @DisplayName("Should record interest score distribution")
        void interestScores() {
            metrics.recordInterestScore(0.2);
            metrics.recordInterestScore(0.6);

            DistributionSummary summary = registry.find("affinity.interest.score").summary();
            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(0.8, summary.totalAmount(), 1e-9);
        }
    }
}
