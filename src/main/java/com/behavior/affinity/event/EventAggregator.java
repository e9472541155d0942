package com.behavior.affinity.event;

import com.behavior.affinity.core.model.AggregatedInterest;
import com.behavior.affinity.core.model.TimeWindow;
import com.behavior.affinity.exception.AggregationException;
import com.behavior.affinity.identity.ResolvedScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Aggregates the events of a window into per-pair incoming scores.
 * An empty result is a successful no-op. Store failures are wrapped in
 * {@link AggregationException}; nothing has been written at that point, so
 * the caller may retry the window.
 */
public class EventAggregator {
    private static final Logger log = LoggerFactory.getLogger(EventAggregator.class);

    private final EventStore store;

    public EventAggregator(EventStore store) {
        this.store = Objects.requireNonNull(store, "store is required");
    }

    /**
     * @throws IllegalArgumentException if start does not precede end
     * @throws AggregationException     if the event store fails
     */
    public List<AggregatedInterest> aggregate(Instant start, Instant end, ResolvedScope scope) {
        return aggregate(TimeWindow.of(start, end), scope);
    }

    public List<AggregatedInterest> aggregate(TimeWindow window, ResolvedScope scope) {
        Objects.requireNonNull(window, "window is required");
        Objects.requireNonNull(scope, "scope is required");

        List<AggregatedInterest> aggregated;
        try {
            aggregated = store.aggregate(window, scope);
        } catch (RuntimeException e) {
            log.error("aggregation.failed window={} cohortId={} error={}", window, scope.cohortId(), e.getMessage());
            throw new AggregationException("Event aggregation failed for window " + window, e);
        }
        // subjectless noise never reaches scoring, whatever the store let through
        List<AggregatedInterest> pairs = aggregated.stream()
                .filter(pair -> !pair.subjectId().isBlank())
                .toList();
        if (pairs.size() < aggregated.size()) {
            log.warn("aggregation.blankSubjectsDropped window={} dropped={}", window, aggregated.size() - pairs.size());
        }
        log.info("aggregation.completed window={} cohortId={} pairs={}", window, scope.cohortId(), pairs.size());
        return pairs;
    }
}
