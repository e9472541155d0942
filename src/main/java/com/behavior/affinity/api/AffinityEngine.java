package com.behavior.affinity.api;

import com.behavior.affinity.core.model.AffinityKey;
import com.behavior.affinity.core.model.AffinityRecord;
import com.behavior.affinity.core.model.AggregatedInterest;
import com.behavior.affinity.core.model.Profile;
import com.behavior.affinity.core.model.ScoringContext;
import com.behavior.affinity.core.model.TimeWindow;
import com.behavior.affinity.decision.Decision;
import com.behavior.affinity.decision.DecisionPipeline;
import com.behavior.affinity.decision.PredictiveEngine;
import com.behavior.affinity.decision.PrescriptiveEngine;
import com.behavior.affinity.event.EventAggregator;
import com.behavior.affinity.event.EventStore;
import com.behavior.affinity.event.GraphEventStore;
import com.behavior.affinity.exception.BatchFailureException;
import com.behavior.affinity.graph.FalkorDBConnection;
import com.behavior.affinity.graph.GraphConnection;
import com.behavior.affinity.graph.InputSanitizer;
import com.behavior.affinity.identity.GraphIdentityStore;
import com.behavior.affinity.identity.IdentityResolver;
import com.behavior.affinity.identity.IdentityStore;
import com.behavior.affinity.identity.ResolvedScope;
import com.behavior.affinity.lock.BatchRunLock;
import com.behavior.affinity.lock.LocalBatchRunLock;
import com.behavior.affinity.logging.LogContext;
import com.behavior.affinity.metrics.EngineMetrics;
import com.behavior.affinity.metrics.NoOpEngineMetrics;
import com.behavior.affinity.retention.AffinityGarbageCollector;
import com.behavior.affinity.retention.RetentionPolicy;
import com.behavior.affinity.retention.RetentionResult;
import com.behavior.affinity.scoring.DecayScoringEngine;
import com.behavior.affinity.store.AffinityStore;
import com.behavior.affinity.store.BatchTransaction;
import com.behavior.affinity.store.GraphAffinityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Main entry point of the behavioral affinity engine.
 *
 * <p>The batch path aggregates a window of events, folds each (profile, subject)
 * pair into its stored score with time decay, and persists the decision derived
 * from the new score. The read path re-runs the decision tables over the stored
 * scores on every call and never writes.</p>
 *
 * <pre>
 * try (AffinityEngine engine = AffinityEngine.builder()
 *         .falkorDB("localhost", 6379, "affinity")
 *         .build()) {
 *     engine.runBatchUpdate("Acme Brokerage", "Active in last 1 months", start, end);
 *     Map&lt;String, DecisionView&gt; decisions = engine.getDecisions(tenantId, profileId);
 * }
 * </pre>
 */
public class AffinityEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AffinityEngine.class);

    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final AffinityStore affinityStore;
    private final IdentityResolver identityResolver;
    private final EventAggregator eventAggregator;
    private final DecayScoringEngine scoringEngine;
    private final DecisionPipeline decisionPipeline;
    private final AffinityGarbageCollector garbageCollector;
    private final BatchRunLock batchRunLock;
    private final EngineMetrics metrics;
    private final EngineOptions options;

    private AffinityEngine(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        this.options = builder.options;
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpEngineMetrics();
        this.batchRunLock = builder.batchRunLock != null ? builder.batchRunLock : new LocalBatchRunLock();

        IdentityStore identityStore = builder.identityStore != null
                ? builder.identityStore : new GraphIdentityStore(connection);
        EventStore eventStore = builder.eventStore != null
                ? builder.eventStore : new GraphEventStore(connection);
        this.affinityStore = builder.affinityStore != null
                ? builder.affinityStore : new GraphAffinityStore(connection, builder.clock);

        this.identityResolver = new IdentityResolver(identityStore, options.getScopeCacheConfig());
        this.eventAggregator = new EventAggregator(eventStore);
        this.scoringEngine = new DecayScoringEngine(options.getHalfLifeDays(), options.getKFactor());
        this.decisionPipeline = new DecisionPipeline(
                new PredictiveEngine(options.getThresholds()), new PrescriptiveEngine());
        this.garbageCollector = new AffinityGarbageCollector(affinityStore, scoringEngine, metrics, builder.clock);

        if (connection != null && builder.createIndexes) {
            connection.createIndexes();
        }
        log.info("AffinityEngine initialized: halfLifeDays={} kFactor={} context={}",
                options.getHalfLifeDays(), options.getKFactor(), options.getScoringContext());
    }

    // ---- batch path ----

    /**
     * Runs the batch update for one window under the default scoring context.
     *
     * @return number of affinity records written
     */
    public int runBatchUpdate(String tenantName, String cohortName, Instant windowStart, Instant windowEnd) {
        return runBatch(tenantName, cohortName, TimeWindow.of(windowStart, windowEnd),
                options.getScoringContext()).rowsTouched();
    }

    public int runBatchUpdate(String tenantName, String cohortName, Instant windowStart, Instant windowEnd,
                              ScoringContext context) {
        return runBatch(tenantName, cohortName, TimeWindow.of(windowStart, windowEnd), context).rowsTouched();
    }

    public BatchRunResult runBatch(String tenantName, String cohortName, TimeWindow window) {
        return runBatch(tenantName, cohortName, window, options.getScoringContext());
    }

    /**
     * Runs the batch update for one window.
     *
     * <p>Aggregates whose newest event is not after the stored last interaction
     * were folded in by an earlier run and are skipped, so re-running a window
     * changes nothing. All writes of the run are reverted if any of them fails.</p>
     *
     * @throws com.behavior.affinity.exception.NotFoundException      if the tenant or cohort does not exist
     * @throws com.behavior.affinity.exception.AggregationException   if the event store fails; nothing was written
     * @throws BatchFailureException                                   if a write fails; earlier writes were reverted
     * @throws com.behavior.affinity.lock.LockAcquisitionException     if another run of the tenant does not finish in time
     */
    public BatchRunResult runBatch(String tenantName, String cohortName, TimeWindow window, ScoringContext context) {
        Objects.requireNonNull(window, "window is required");
        Objects.requireNonNull(context, "context is required");
        String runId = LogContext.generateRunId();

        try (LogContext ctx = LogContext.forBatchRun(runId, tenantName, cohortName)) {
            log.info("batch.starting window={} context={}", window, context);
            long startNanos = System.nanoTime();
            boolean success = false;
            try {
                ResolvedScope scope = identityResolver.resolve(tenantName, cohortName);
                batchRunLock.lock(scope.tenantId());
                try {
                    BatchRunResult result = processWindow(runId, scope, window, context, startNanos);
                    success = true;
                    log.info("batch.completed runId={} pairs={} rowsTouched={} replaysSkipped={} durationMs={}",
                            runId, result.aggregatedPairs(), result.rowsTouched(), result.replaysSkipped(),
                            result.duration().toMillis());
                    return result;
                } finally {
                    batchRunLock.unlock(scope.tenantId());
                }
            } finally {
                metrics.recordBatchDuration(Duration.ofNanos(System.nanoTime() - startNanos), success);
            }
        }
    }

    private BatchRunResult processWindow(String runId, ResolvedScope scope, TimeWindow window,
                                         ScoringContext context, long startNanos) {
        List<AggregatedInterest> pairs = eventAggregator.aggregate(window, scope);
        if (pairs.isEmpty()) {
            log.info("batch.noEvents runId={} window={}", runId, window);
            return new BatchRunResult(runId, window, 0, 0, 0, Duration.ofNanos(System.nanoTime() - startNanos));
        }

        Map<String, Set<String>> personasByProfile = new HashMap<>();
        int replaysSkipped = 0;
        List<Decision> decisions = new ArrayList<>(pairs.size());

        try (BatchTransaction tx = new BatchTransaction(runId, affinityStore)) {
            for (AggregatedInterest pair : pairs) {
                try {
                    AffinityKey key = AffinityKey.of(scope.tenantId(), pair.profileId(), pair.subjectId(), context);
                    AffinityRecord prior = affinityStore.get(key).orElse(null);
                    if (prior != null && !pair.lastEventTime().isAfter(prior.getLastInteractionAt())) {
                        replaysSkipped++;
                        log.debug("batch.replaySkipped key={} lastEventTime={}", key, pair.lastEventTime());
                        continue;
                    }

                    double newRaw = prior != null
                            ? scoringEngine.computeNewRaw(prior.getRawScore(), prior.getLastInteractionAt(),
                                    pair.incomingScore(), pair.lastEventTime())
                            : scoringEngine.computeNewRaw(0.0, null, pair.incomingScore(), pair.lastEventTime());
                    double interest = scoringEngine.normalize(newRaw);
                    Set<String> personas = personasByProfile.computeIfAbsent(pair.profileId(),
                            profileId -> identityResolver.personasOf(scope.tenantId(), profileId));
                    Decision decision = decisionPipeline.decide(interest, personas);

                    tx.write(key, prior, () -> {
                        affinityStore.upsert(key, newRaw, interest, pair.lastEventTime());
                        affinityStore.upsertDecision(key,
                                decision.prediction().event().name(),
                                decision.prediction().probability(),
                                decision.prescription().action().name(),
                                decision.prescription().confidence());
                    });
                    decisions.add(decision);
                } catch (BatchFailureException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warn("batch.pairFailed runId={} profileId={} subjectId={} error={}",
                            runId, pair.profileId(), pair.subjectId(), e.getMessage());
                    throw tx.abort(e);
                }
            }
            tx.markSuccess();
        }

        // metrics only after commit, so a rolled back run records nothing
        metrics.incrementRowsScored(decisions.size());
        metrics.incrementReplaysSkipped(replaysSkipped);
        for (Decision decision : decisions) {
            metrics.recordInterestScore(decision.interestScore());
            metrics.incrementDecision(decision.prescription().action());
        }
        return new BatchRunResult(runId, window, pairs.size(), decisions.size(), replaysSkipped,
                Duration.ofNanos(System.nanoTime() - startNanos));
    }

    // ---- read path ----

    /**
     * Next best action per subject for one profile, computed from the stored
     * scores. Returns an empty map for an unknown profile. A failure for any
     * subject propagates instead of returning a partial map.
     */
    public Map<String, DecisionView> getDecisions(String tenantId, String profileId) {
        return decideForProfile(tenantId, profileId, d -> DecisionView.of(d.prescription()));
    }

    /**
     * Next likely action per subject for one profile, computed from the stored scores.
     */
    public Map<String, PredictionView> getPredictions(String tenantId, String profileId) {
        return decideForProfile(tenantId, profileId, d -> PredictionView.of(d.prediction()));
    }

    /**
     * Profiles whose stored interest in the subject is at least {@code minScore},
     * highest first, capped at the audience page size.
     */
    public List<InterestedProfile> findInterested(String tenantId, String subjectId, double minScore) {
        InputSanitizer.requireIdentifier(tenantId, "tenantId");
        InputSanitizer.requireIdentifier(subjectId, "subjectId");
        InputSanitizer.requireScoreBound(minScore, "minScore");

        // the store returns one record per profile, its strongest context
        return affinityStore.findInterested(tenantId, subjectId, minScore, options.getAudiencePageSize())
                .stream()
                .map(r -> new InterestedProfile(r.getProfileId(), r.getInterestScore(), r.getRawScore()))
                .toList();
    }

    /**
     * Stored scores of every subject of a profile with a fresh next likely action,
     * plus the profile's identifiers and personas.
     *
     * @param profileRef the profile id or the fingerprint its events carry
     */
    public ProfileAffinity getProfileAffinity(String tenantId, String profileRef) {
        InputSanitizer.requireIdentifier(tenantId, "tenantId");
        InputSanitizer.requireIdentifier(profileRef, "profileRef");

        try (LogContext ctx = LogContext.forProfileLookup(tenantId, profileRef)) {
            Optional<Profile> profile = identityResolver.findProfile(tenantId, profileRef);
            String profileId = profile.map(Profile::profileId).orElse(profileRef);
            Set<String> personas = profile.map(Profile::personas).orElse(Set.of());
            Map<String, ProfileAffinity.SubjectAffinity> subjects = new LinkedHashMap<>();
            for (AffinityRecord record : affinityStore.scanByProfile(tenantId, profileId)) {
                if (subjects.containsKey(record.getSubjectId())) {
                    continue;
                }
                Decision decision = decisionPipeline.decide(record.getInterestScore(), personas);
                subjects.put(record.getSubjectId(), new ProfileAffinity.SubjectAffinity(
                        record.getSubjectId(),
                        record.getRawScore(),
                        record.getInterestScore(),
                        record.getLastInteractionAt(),
                        PredictionView.of(decision.prediction())));
            }
            log.debug("read.profileAffinity subjects={}", subjects.size());
            return new ProfileAffinity(tenantId, profileId, profile.map(Profile::fingerprintId).orElse(null),
                    personas, new ArrayList<>(subjects.values()));
        }
    }

    private <V> Map<String, V> decideForProfile(String tenantId, String profileId, Function<Decision, V> view) {
        InputSanitizer.requireIdentifier(tenantId, "tenantId");
        InputSanitizer.requireIdentifier(profileId, "profileId");

        try (LogContext ctx = LogContext.forProfileLookup(tenantId, profileId)) {
            List<AffinityRecord> records = affinityStore.scanByProfile(tenantId, profileId);
            if (records.isEmpty()) {
                return Map.of();
            }
            Set<String> personas = identityResolver.personasOf(tenantId, profileId);
            Map<String, V> result = new LinkedHashMap<>();
            for (AffinityRecord record : records) {
                // records arrive highest interest first; the strongest context wins
                if (!result.containsKey(record.getSubjectId())) {
                    result.put(record.getSubjectId(), view.apply(
                            decisionPipeline.decide(record.getInterestScore(), personas)));
                }
            }
            log.debug("read.decisions subjects={}", result.size());
            return Collections.unmodifiableMap(result);
        }
    }

    // ---- garbage collection ----

    public RetentionResult collectGarbage() {
        return garbageCollector.collect(options.getRetentionPolicy());
    }

    public RetentionResult collectGarbage(RetentionPolicy policy) {
        return garbageCollector.collect(policy);
    }

    // ---- accessors ----

    public DecayScoringEngine getScoringEngine() {
        return scoringEngine;
    }

    public IdentityResolver getIdentityResolver() {
        return identityResolver;
    }

    public EngineOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        if (ownsConnection && connection != null) {
            connection.close();
        }
        log.info("AffinityEngine closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private IdentityStore identityStore;
        private EventStore eventStore;
        private AffinityStore affinityStore;
        private EngineOptions options = EngineOptions.defaults();
        private BatchRunLock batchRunLock;
        private EngineMetrics metrics;
        private Clock clock = Clock.systemUTC();
        private boolean createIndexes = true;

        /**
         * Sets the graph connection backing every store not set explicitly.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Creates a FalkorDB connection owned and closed by the engine.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        public Builder identityStore(IdentityStore identityStore) {
            this.identityStore = identityStore;
            return this;
        }

        public Builder eventStore(EventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        public Builder affinityStore(AffinityStore affinityStore) {
            this.affinityStore = affinityStore;
            return this;
        }

        public Builder options(EngineOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Defaults to {@link LocalBatchRunLock}.
         */
        public Builder batchRunLock(BatchRunLock batchRunLock) {
            this.batchRunLock = batchRunLock;
            return this;
        }

        /**
         * Defaults to {@link NoOpEngineMetrics}.
         */
        public Builder metrics(EngineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Clock used for {@code updatedAt} stamps and decayed garbage collection.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Controls whether graph indexes are created on startup.
         */
        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public AffinityEngine build() {
            Objects.requireNonNull(options, "options is required");
            Objects.requireNonNull(clock, "clock is required");
            if (connection == null && (identityStore == null || eventStore == null || affinityStore == null)) {
                throw new IllegalStateException(
                        "GraphConnection is required unless identity, event and affinity stores are all set");
            }
            return new AffinityEngine(this);
        }
    }
}
