package com.behavior.affinity.event;

import com.behavior.affinity.core.model.AggregatedInterest;
import com.behavior.affinity.core.model.BehavioralEvent;
import com.behavior.affinity.core.model.TimeWindow;
import com.behavior.affinity.graph.GraphConnection;
import com.behavior.affinity.identity.ResolvedScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB-backed event store.
 *
 * <p>Events are {@code :TrackingEvent {fingerprintId, timestampMillis, metricName, subject}}
 * nodes; weights are {@code :EventMetric {eventName, score}} nodes. Aggregation
 * joins events to profiles by fingerprint, filters on the cohort id list of the
 * profile and inner-joins the metric table.</p>
 */
public class GraphEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(GraphEventStore.class);

    private final GraphConnection connection;

    public GraphEventStore(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public List<AggregatedInterest> aggregate(TimeWindow window, ResolvedScope scope) {
        String query = """
                MATCH (ev:TrackingEvent)
                WHERE ev.timestampMillis >= $startMillis
                  AND ev.timestampMillis < $endMillis
                  AND ev.subject IS NOT NULL
                  AND trim(ev.subject) <> ''
                MATCH (p:Profile {tenantId: $tenantId, fingerprintId: ev.fingerprintId})
                WHERE $cohortId IN p.cohortIds
                MATCH (m:EventMetric {eventName: ev.metricName})
                RETURN p.profileId as profileId, ev.subject as subjectId,
                       sum(m.score) as incomingScore, max(ev.timestampMillis) as lastEventMillis
                """;
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "startMillis", window.start().toEpochMilli(),
                "endMillis", window.end().toEpochMilli(),
                "tenantId", scope.tenantId(),
                "cohortId", scope.cohortId()
        ));

        List<AggregatedInterest> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            String subjectId = (String) row.get("subjectId");
            if (subjectId == null || subjectId.isBlank()) {
                log.debug("Skipping aggregate without subject for profile {}", row.get("profileId"));
                continue;
            }
            result.add(new AggregatedInterest(
                    (String) row.get("profileId"),
                    subjectId,
                    ((Number) row.get("incomingScore")).doubleValue(),
                    Instant.ofEpochMilli(((Number) row.get("lastEventMillis")).longValue())));
        }
        log.debug("Aggregated {} pairs in {}", result.size(), window);
        return result;
    }

    /**
     * Appends a tracking event. Events are owned upstream; this seeds graphs
     * for tooling and integration tests.
     */
    public void record(BehavioralEvent event) {
        String query = """
                CREATE (ev:TrackingEvent {
                    fingerprintId: $fingerprintId,
                    timestampMillis: $timestampMillis,
                    metricName: $metricName,
                    subject: $subject
                })
                """;
        // HashMap: subject may be null
        Map<String, Object> params = new HashMap<>();
        params.put("fingerprintId", event.profileIdentifier());
        params.put("timestampMillis", event.timestamp().toEpochMilli());
        params.put("metricName", event.eventTypeName());
        params.put("subject", event.subject());
        connection.execute(query, params);
    }

    /**
     * Creates or updates the weight of every event type in the table.
     */
    public void saveWeights(EventWeights weights) {
        String query = """
                MERGE (m:EventMetric {eventName: $eventName})
                SET m.score = $score
                """;
        weights.asMap().forEach((name, score) ->
                connection.execute(query, Map.of("eventName", name, "score", score)));
        log.info("Saved {} event weights", weights.asMap().size());
    }
}
