package com.behavior.affinity.metrics;

import com.behavior.affinity.decision.RecommendedAction;

import java.time.Duration;

/**
 * Interface for recording engine metrics.
 * The default {@link NoOpEngineMetrics} does nothing, so the engine works
 * without any metrics dependency on the classpath.
 */
public interface EngineMetrics {

    void recordBatchDuration(Duration duration, boolean success);

    void incrementRowsScored(int rows);

    void incrementReplaysSkipped(int replays);

    void incrementGcDeleted(long deleted);

    void incrementDecision(RecommendedAction action);

    void recordInterestScore(double score);
}
