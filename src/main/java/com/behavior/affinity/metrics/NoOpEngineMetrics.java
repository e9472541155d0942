package com.behavior.affinity.metrics;

import com.behavior.affinity.decision.RecommendedAction;

import java.time.Duration;

/**
 * No-op implementation of {@link EngineMetrics}. Used by default.
 */
public class NoOpEngineMetrics implements EngineMetrics {

    @Override
    public void recordBatchDuration(Duration duration, boolean success) {
    }

    @Override
    public void incrementRowsScored(int rows) {
    }

    @Override
    public void incrementReplaysSkipped(int replays) {
    }

    @Override
    public void incrementGcDeleted(long deleted) {
    }

    @Override
    public void incrementDecision(RecommendedAction action) {
    }

    @Override
    public void recordInterestScore(double score) {
    }
}
