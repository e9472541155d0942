package com.behavior.affinity.metrics;

import com.behavior.affinity.decision.RecommendedAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link EngineMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code affinity.batch.duration}: Timer (tag: outcome)</li>
 *   <li>{@code affinity.rows.scored}: Counter</li>
 *   <li>{@code affinity.replays.skipped}: Counter</li>
 *   <li>{@code affinity.gc.deleted}: Counter</li>
 *   <li>{@code affinity.decision}: Counter (tag: action)</li>
 *   <li>{@code affinity.interest.score}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerEngineMetrics implements EngineMetrics {

    private final Timer batchSuccessTimer;
    private final Timer batchFailureTimer;
    private final Counter rowsScoredCounter;
    private final Counter replaysSkippedCounter;
    private final Counter gcDeletedCounter;
    private final Map<RecommendedAction, Counter> decisionCounters = new EnumMap<>(RecommendedAction.class);
    private final DistributionSummary interestScoreSummary;

    public MicrometerEngineMetrics(MeterRegistry registry) {
        this.batchSuccessTimer = batchTimer(registry, "success");
        this.batchFailureTimer = batchTimer(registry, "failure");
        this.rowsScoredCounter = Counter.builder("affinity.rows.scored")
                .description("Affinity records written by batch runs")
                .register(registry);
        this.replaysSkippedCounter = Counter.builder("affinity.replays.skipped")
                .description("Aggregates skipped because they were already folded in")
                .register(registry);
        this.gcDeletedCounter = Counter.builder("affinity.gc.deleted")
                .description("Affinity records removed by garbage collection")
                .register(registry);
        for (RecommendedAction action : RecommendedAction.values()) {
            decisionCounters.put(action, Counter.builder("affinity.decision")
                    .description("Decisions persisted by batch runs")
                    .tag("action", action.name())
                    .register(registry));
        }
        this.interestScoreSummary = DistributionSummary.builder("affinity.interest.score")
                .description("Distribution of interest scores written by batch runs")
                .register(registry);
    }

    private static Timer batchTimer(MeterRegistry registry, String outcome) {
        return Timer.builder("affinity.batch.duration")
                .description("Duration of batch scoring runs")
                .tag("outcome", outcome)
                .register(registry);
    }

    @Override
    public void recordBatchDuration(Duration duration, boolean success) {
        (success ? batchSuccessTimer : batchFailureTimer).record(duration);
    }

    @Override
    public void incrementRowsScored(int rows) {
        rowsScoredCounter.increment(rows);
    }

    @Override
    public void incrementReplaysSkipped(int replays) {
        replaysSkippedCounter.increment(replays);
    }

    @Override
    public void incrementGcDeleted(long deleted) {
        gcDeletedCounter.increment(deleted);
    }

    @Override
    public void incrementDecision(RecommendedAction action) {
        decisionCounters.get(action).increment();
    }

    @Override
    public void recordInterestScore(double score) {
        interestScoreSummary.record(score);
    }
}
