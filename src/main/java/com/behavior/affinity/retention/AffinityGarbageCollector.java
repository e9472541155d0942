package com.behavior.affinity.retention;

import com.behavior.affinity.logging.LogContext;
import com.behavior.affinity.metrics.EngineMetrics;
import com.behavior.affinity.metrics.NoOpEngineMetrics;
import com.behavior.affinity.scoring.DecayScoringEngine;
import com.behavior.affinity.store.AffinityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Removes affinity records whose interest has fallen below the retention threshold.
 *
 * <p>Deletes in batches until a batch comes back short. Never throws: store
 * failures are logged and reported in the {@link RetentionResult}, and a later
 * pass picks up where this one stopped. Runs without the batch lock; a record
 * that a concurrent batch run revives is simply recreated by that run.</p>
 */
public class AffinityGarbageCollector {
    private static final Logger log = LoggerFactory.getLogger(AffinityGarbageCollector.class);

    private final AffinityStore store;
    private final DecayScoringEngine scoringEngine;
    private final EngineMetrics metrics;
    private final Clock clock;

    public AffinityGarbageCollector(AffinityStore store, DecayScoringEngine scoringEngine) {
        this(store, scoringEngine, new NoOpEngineMetrics(), Clock.systemUTC());
    }

    public AffinityGarbageCollector(AffinityStore store, DecayScoringEngine scoringEngine,
                                    EngineMetrics metrics, Clock clock) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.scoringEngine = Objects.requireNonNull(scoringEngine, "scoringEngine is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public RetentionResult collect() {
        return collect(RetentionPolicy.defaults());
    }

    public RetentionResult collect(RetentionPolicy policy) {
        Objects.requireNonNull(policy, "policy is required");
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forGarbageCollection(runId)) {
            log.info("gc.starting threshold={} evaluation={} batchSize={}",
                    policy.threshold(), policy.evaluation(), policy.batchSize());
            Instant asOf = clock.instant();

            long total = 0;
            int batches = 0;
            int deleted;
            try {
                do {
                    deleted = deleteBatch(policy, asOf);
                    batches++;
                    total += deleted;
                    if (deleted > 0) {
                        log.debug("gc.deletedBatch batch={} total={}", deleted, total);
                    }
                } while (deleted >= policy.batchSize());
            } catch (RuntimeException e) {
                log.error("gc.failed deleted={} batches={} error={}", total, batches, e.getMessage(), e);
                metrics.incrementGcDeleted(total);
                return RetentionResult.failure(total, batches, e.getMessage());
            }

            metrics.incrementGcDeleted(total);
            RetentionResult result = RetentionResult.success(total, batches);
            log.info("gc.completed result={}", result);
            return result;
        }
    }

    private int deleteBatch(RetentionPolicy policy, Instant asOf) {
        return switch (policy.evaluation()) {
            case STORED -> store.deleteBelow(policy.threshold(), policy.batchSize());
            case DECAYED -> store.deleteDecayedBelow(policy.threshold(), asOf,
                    scoringEngine.getHalfLifeDays(), scoringEngine.getKFactor(), policy.batchSize());
        };
    }
}
