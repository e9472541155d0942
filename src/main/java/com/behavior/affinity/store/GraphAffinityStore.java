package com.behavior.affinity.store;

import com.behavior.affinity.core.model.AffinityKey;
import com.behavior.affinity.core.model.AffinityRecord;
import com.behavior.affinity.exception.PersistenceException;
import com.behavior.affinity.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * FalkorDB-backed affinity store. Each record is an {@code :AffinityRecord}
 * node identified by its six key properties; timestamps are stored as epoch
 * milliseconds so range and decay arithmetic stay numeric.
 */
public class GraphAffinityStore implements AffinityStore {
    private static final Logger log = LoggerFactory.getLogger(GraphAffinityStore.class);

    private static final String KEY_PATTERN = """
            (r:AffinityRecord {tenantId: $tenantId, profileId: $profileId, subjectId: $subjectId,
                               contextMapId: $contextMapId, contextStageId: $contextStageId, modelId: $modelId})""";

    private static final String RETURN_COLUMNS = """
            RETURN r.tenantId as tenantId, r.profileId as profileId, r.subjectId as subjectId,
                   r.contextMapId as contextMapId, r.contextStageId as contextStageId, r.modelId as modelId,
                   r.rawScore as rawScore, r.interestScore as interestScore,
                   r.lastInteractionMillis as lastInteractionMillis,
                   r.predictedUserEvent as predictedUserEvent, r.predictionProbability as predictionProbability,
                   r.nextBestAction as nextBestAction, r.nbaConfidence as nbaConfidence,
                   r.updatedMillis as updatedMillis
            """;

    private final GraphConnection connection;
    private final Clock clock;

    public GraphAffinityStore(GraphConnection connection) {
        this(connection, Clock.systemUTC());
    }

    public GraphAffinityStore(GraphConnection connection, Clock clock) {
        this.connection = Objects.requireNonNull(connection, "connection is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public Optional<AffinityRecord> get(AffinityKey key) {
        String query = "MATCH " + KEY_PATTERN + "\n" + RETURN_COLUMNS;
        List<AffinityRecord> found = guarded("get " + key, () -> mapResults(connection.query(query, keyParams(key))));
        return found.stream().findFirst();
    }

    @Override
    public void upsert(AffinityKey key, double rawScore, double interestScore, Instant lastInteractionAt) {
        String query = "MERGE " + KEY_PATTERN + """

                SET r.rawScore = $rawScore,
                    r.interestScore = $interestScore,
                    r.lastInteractionMillis = $lastInteractionMillis,
                    r.updatedMillis = $updatedMillis
                """;
        Map<String, Object> params = keyParams(key);
        params.put("rawScore", rawScore);
        params.put("interestScore", interestScore);
        params.put("lastInteractionMillis", lastInteractionAt.toEpochMilli());
        params.put("updatedMillis", clock.millis());
        guarded("upsert " + key, () -> {
            connection.execute(query, params);
            return null;
        });
        log.debug("Upserted affinity {} raw={} interest={}", key, rawScore, interestScore);
    }

    @Override
    public void upsertDecision(AffinityKey key, String predictedEvent, double probability,
                               String nextBestAction, double confidence) {
        String query = "MATCH " + KEY_PATTERN + """

                SET r.predictedUserEvent = $predictedUserEvent,
                    r.predictionProbability = $predictionProbability,
                    r.nextBestAction = $nextBestAction,
                    r.nbaConfidence = $nbaConfidence,
                    r.updatedMillis = $updatedMillis
                RETURN count(r) as updated
                """;
        Map<String, Object> params = keyParams(key);
        params.put("predictedUserEvent", predictedEvent);
        params.put("predictionProbability", probability);
        params.put("nextBestAction", nextBestAction);
        params.put("nbaConfidence", confidence);
        params.put("updatedMillis", clock.millis());
        long updated = guarded("upsertDecision " + key, () -> extractCount(connection.query(query, params), "updated"));
        if (updated == 0) {
            throw new PersistenceException("No affinity record to attach a decision to: " + key);
        }
    }

    @Override
    public List<AffinityRecord> scan(String tenantId, double minInterestScore) {
        String query = """
                MATCH (r:AffinityRecord {tenantId: $tenantId})
                WHERE r.interestScore >= $minScore
                """ + RETURN_COLUMNS + "ORDER BY r.interestScore DESC";
        return guarded("scan " + tenantId, () -> mapResults(connection.query(query, Map.of(
                "tenantId", tenantId,
                "minScore", minInterestScore
        ))));
    }

    @Override
    public List<AffinityRecord> scanByProfile(String tenantId, String profileId) {
        String query = "MATCH (r:AffinityRecord {tenantId: $tenantId, profileId: $profileId})\n"
                + RETURN_COLUMNS + "ORDER BY r.interestScore DESC";
        return guarded("scanByProfile " + profileId, () -> mapResults(connection.query(query, Map.of(
                "tenantId", tenantId,
                "profileId", profileId
        ))));
    }

    @Override
    public List<AffinityRecord> findInterested(String tenantId, String subjectId, double minScore, int limit) {
        String query = """
                MATCH (r:AffinityRecord {tenantId: $tenantId, subjectId: $subjectId})
                WHERE r.interestScore >= $minScore
                WITH r ORDER BY r.interestScore DESC
                WITH r.profileId as pid, collect(r)[0] as best
                WITH best as r
                """ + RETURN_COLUMNS + "ORDER BY r.interestScore DESC\nLIMIT $limit";
        return guarded("findInterested " + subjectId, () -> mapResults(connection.query(query, Map.of(
                "tenantId", tenantId,
                "subjectId", subjectId,
                "minScore", minScore,
                "limit", limit
        ))));
    }

    @Override
    public boolean delete(AffinityKey key) {
        String query = "MATCH " + KEY_PATTERN + """

                DELETE r
                RETURN count(r) as deleted
                """;
        return guarded("delete " + key, () -> extractCount(connection.query(query, keyParams(key)), "deleted")) > 0;
    }

    @Override
    public void restore(AffinityRecord record) {
        String query = "MERGE " + KEY_PATTERN + """

                SET r.rawScore = $rawScore,
                    r.interestScore = $interestScore,
                    r.lastInteractionMillis = $lastInteractionMillis,
                    r.predictedUserEvent = $predictedUserEvent,
                    r.predictionProbability = $predictionProbability,
                    r.nextBestAction = $nextBestAction,
                    r.nbaConfidence = $nbaConfidence,
                    r.updatedMillis = $updatedMillis
                """;
        // HashMap: decision columns may be null, which removes the property
        Map<String, Object> params = keyParams(record.getKey());
        params.put("rawScore", record.getRawScore());
        params.put("interestScore", record.getInterestScore());
        params.put("lastInteractionMillis", record.getLastInteractionAt().toEpochMilli());
        params.put("predictedUserEvent", record.getPredictedUserEvent());
        params.put("predictionProbability", record.getPredictionProbability());
        params.put("nextBestAction", record.getNextBestAction());
        params.put("nbaConfidence", record.getNbaConfidence());
        params.put("updatedMillis", record.getUpdatedAt().toEpochMilli());
        guarded("restore " + record.getKey(), () -> {
            connection.execute(query, params);
            return null;
        });
    }

    @Override
    public int deleteBelow(double threshold, int limit) {
        String query = """
                MATCH (r:AffinityRecord)
                WHERE r.interestScore < $threshold
                WITH r LIMIT $batchSize
                DELETE r
                RETURN count(r) as deleted
                """;
        return guarded("deleteBelow", () -> extractCount(connection.query(query, Map.of(
                "threshold", threshold,
                "batchSize", limit
        )), "deleted")).intValue();
    }

    @Override
    public int deleteDecayedBelow(double threshold, Instant asOf, double halfLifeDays, double kFactor, int limit) {
        String query = """
                MATCH (r:AffinityRecord)
                WITH r, CASE WHEN $asOfMillis > r.lastInteractionMillis
                             THEN ($asOfMillis - r.lastInteractionMillis) / 86400000.0
                             ELSE 0.0 END AS elapsedDays
                WITH r, r.rawScore * (0.5 ^ (elapsedDays / $halfLifeDays)) AS decayed
                WHERE decayed / (decayed + $kFactor) < $threshold
                WITH r LIMIT $batchSize
                DELETE r
                RETURN count(r) as deleted
                """;
        return guarded("deleteDecayedBelow", () -> extractCount(connection.query(query, Map.of(
                "asOfMillis", asOf.toEpochMilli(),
                "halfLifeDays", halfLifeDays,
                "kFactor", kFactor,
                "threshold", threshold,
                "batchSize", limit
        )), "deleted")).intValue();
    }

    private static Map<String, Object> keyParams(AffinityKey key) {
        Map<String, Object> params = new HashMap<>();
        params.put("tenantId", key.tenantId());
        params.put("profileId", key.profileId());
        params.put("subjectId", key.subjectId());
        params.put("contextMapId", key.contextMapId());
        params.put("contextStageId", key.contextStageId());
        params.put("modelId", key.modelId());
        return params;
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (PersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException("Affinity store operation failed: " + operation, e);
        }
    }

    private List<AffinityRecord> mapResults(List<Map<String, Object>> results) {
        List<AffinityRecord> records = new ArrayList<>(results.size());
        for (Map<String, Object> row : results) {
            AffinityKey key = new AffinityKey(
                    (String) row.get("tenantId"),
                    (String) row.get("profileId"),
                    (String) row.get("subjectId"),
                    (String) row.get("contextMapId"),
                    (String) row.get("contextStageId"),
                    (String) row.get("modelId"));
            records.add(AffinityRecord.builder()
                    .key(key)
                    .rawScore(toDouble(row.get("rawScore")))
                    .interestScore(toDouble(row.get("interestScore")))
                    .lastInteractionAt(Instant.ofEpochMilli(toLong(row.get("lastInteractionMillis"))))
                    .predictedUserEvent((String) row.get("predictedUserEvent"))
                    .predictionProbability(toNullableDouble(row.get("predictionProbability")))
                    .nextBestAction((String) row.get("nextBestAction"))
                    .nbaConfidence(toNullableDouble(row.get("nbaConfidence")))
                    .updatedAt(Instant.ofEpochMilli(toLong(row.get("updatedMillis"))))
                    .build());
        }
        return records;
    }

    private static double toDouble(Object val) {
        if (val instanceof Number n) {
            return n.doubleValue();
        }
        throw new PersistenceException("Expected numeric column, got " + val);
    }

    private static Double toNullableDouble(Object val) {
        return val instanceof Number n ? n.doubleValue() : null;
    }

    private static long toLong(Object val) {
        if (val instanceof Number n) {
            return n.longValue();
        }
        throw new PersistenceException("Expected numeric column, got " + val);
    }

    private static long extractCount(List<Map<String, Object>> results, String column) {
        if (results.isEmpty()) return 0;
        Object val = results.get(0).get(column);
        if (val instanceof Number n) {
            return n.longValue();
        }
        return 0;
    }
}
