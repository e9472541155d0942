package com.behavior.affinity.api;

import com.behavior.affinity.core.model.TimeWindow;

import java.time.Duration;

/**
 * Outcome of one batch run.
 *
 * @param runId           id used in logs and in {@link com.behavior.affinity.exception.BatchFailureException}
 * @param window          the aggregated window
 * @param aggregatedPairs (profile, subject) pairs found in the window
 * @param rowsTouched     affinity records written
 * @param replaysSkipped  pairs already folded in by an earlier run of the same window
 * @param duration        wall-clock duration of the run
 */
public record BatchRunResult(
        String runId,
        TimeWindow window,
        int aggregatedPairs,
        int rowsTouched,
        int replaysSkipped,
        Duration duration
) {
}
