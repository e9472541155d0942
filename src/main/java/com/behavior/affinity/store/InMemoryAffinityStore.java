package com.behavior.affinity.store;

import com.behavior.affinity.core.model.AffinityKey;
import com.behavior.affinity.core.model.AffinityRecord;
import com.behavior.affinity.exception.PersistenceException;
import com.behavior.affinity.scoring.DecayScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Thread-safe in-memory affinity store backed by a ConcurrentHashMap.
 * Suitable for tests and embedded use.
 */
public class InMemoryAffinityStore implements AffinityStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryAffinityStore.class);

    private static final Comparator<AffinityRecord> BY_INTEREST_DESC =
            Comparator.comparingDouble(AffinityRecord::getInterestScore).reversed();

    private final Map<AffinityKey, AffinityRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryAffinityStore() {
        this(Clock.systemUTC());
    }

    public InMemoryAffinityStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public Optional<AffinityRecord> get(AffinityKey key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public void upsert(AffinityKey key, double rawScore, double interestScore, Instant lastInteractionAt) {
        Instant now = clock.instant();
        records.compute(key, (k, existing) -> {
            AffinityRecord.Builder builder = existing != null ? existing.toBuilder() : AffinityRecord.builder().key(k);
            return builder.rawScore(rawScore)
                    .interestScore(interestScore)
                    .lastInteractionAt(lastInteractionAt)
                    .updatedAt(now)
                    .build();
        });
        log.debug("Upserted affinity {} raw={} interest={}", key, rawScore, interestScore);
    }

    @Override
    public void upsertDecision(AffinityKey key, String predictedEvent, double probability,
                               String nextBestAction, double confidence) {
        Instant now = clock.instant();
        AffinityRecord updated = records.computeIfPresent(key, (k, existing) -> existing.toBuilder()
                .predictedUserEvent(predictedEvent)
                .predictionProbability(probability)
                .nextBestAction(nextBestAction)
                .nbaConfidence(confidence)
                .updatedAt(now)
                .build());
        if (updated == null) {
            throw new PersistenceException("No affinity record to attach a decision to: " + key);
        }
    }

    @Override
    public List<AffinityRecord> scan(String tenantId, double minInterestScore) {
        return select(r -> r.getTenantId().equals(tenantId) && r.getInterestScore() >= minInterestScore,
                Integer.MAX_VALUE);
    }

    @Override
    public List<AffinityRecord> scanByProfile(String tenantId, String profileId) {
        return select(r -> r.getTenantId().equals(tenantId) && r.getProfileId().equals(profileId),
                Integer.MAX_VALUE);
    }

    @Override
    public List<AffinityRecord> findInterested(String tenantId, String subjectId, double minScore, int limit) {
        Map<String, AffinityRecord> bestByProfile = new HashMap<>();
        for (AffinityRecord record : records.values()) {
            if (record.getTenantId().equals(tenantId)
                    && record.getSubjectId().equals(subjectId)
                    && record.getInterestScore() >= minScore) {
                bestByProfile.merge(record.getProfileId(), record,
                        (a, b) -> a.getInterestScore() >= b.getInterestScore() ? a : b);
            }
        }
        return bestByProfile.values().stream()
                .sorted(BY_INTEREST_DESC)
                .limit(limit)
                .toList();
    }

    @Override
    public boolean delete(AffinityKey key) {
        return records.remove(key) != null;
    }

    @Override
    public void restore(AffinityRecord record) {
        records.put(record.getKey(), record);
    }

    @Override
    public int deleteBelow(double threshold, int limit) {
        return deleteMatching(r -> r.getInterestScore() < threshold, limit);
    }

    @Override
    public int deleteDecayedBelow(double threshold, Instant asOf, double halfLifeDays, double kFactor, int limit) {
        DecayScoringEngine engine = new DecayScoringEngine(halfLifeDays, kFactor);
        return deleteMatching(r -> engine.effectiveInterest(r, asOf) < threshold, limit);
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
    }

    private List<AffinityRecord> select(Predicate<AffinityRecord> filter, int limit) {
        return records.values().stream()
                .filter(filter)
                .sorted(BY_INTEREST_DESC)
                .limit(limit)
                .toList();
    }

    private int deleteMatching(Predicate<AffinityRecord> filter, int limit) {
        List<AffinityKey> victims = records.values().stream()
                .filter(filter)
                .limit(limit)
                .map(AffinityRecord::getKey)
                .toList();
        int deleted = 0;
        for (AffinityKey key : victims) {
            if (records.remove(key) != null) {
                deleted++;
            }
        }
        return deleted;
    }
}
