package com.behavior.affinity.event;

import com.behavior.affinity.core.model.AggregatedInterest;
import com.behavior.affinity.core.model.BehavioralEvent;
import com.behavior.affinity.core.model.Profile;
import com.behavior.affinity.core.model.TimeWindow;
import com.behavior.affinity.identity.InMemoryIdentityStore;
import com.behavior.affinity.identity.ResolvedScope;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory event store joining events to profiles of an {@link InMemoryIdentityStore}.
 */
public class InMemoryEventStore implements EventStore {

    private final List<BehavioralEvent> events = new CopyOnWriteArrayList<>();
    private final InMemoryIdentityStore identities;
    private final EventWeights weights;

    public InMemoryEventStore(InMemoryIdentityStore identities, EventWeights weights) {
        this.identities = Objects.requireNonNull(identities, "identities is required");
        this.weights = Objects.requireNonNull(weights, "weights is required");
    }

    public InMemoryEventStore record(BehavioralEvent event) {
        events.add(event);
        return this;
    }

    @Override
    public List<AggregatedInterest> aggregate(TimeWindow window, ResolvedScope scope) {
        Map<PairKey, Accumulator> groups = new LinkedHashMap<>();
        for (BehavioralEvent event : events) {
            if (!window.contains(event.timestamp()) || !event.hasSubject()) {
                continue;
            }
            Optional<Profile> profile = identities.findByFingerprint(scope.tenantId(), event.profileIdentifier());
            if (profile.isEmpty() || !profile.get().isInCohort(scope.cohortId())) {
                continue;
            }
            OptionalDouble weight = weights.weightOf(event.eventTypeName());
            if (weight.isEmpty()) {
                continue;
            }
            groups.computeIfAbsent(new PairKey(profile.get().profileId(), event.subject()), k -> new Accumulator())
                    .add(weight.getAsDouble(), event.timestamp());
        }

        List<AggregatedInterest> result = new ArrayList<>(groups.size());
        groups.forEach((key, acc) ->
                result.add(new AggregatedInterest(key.profileId(), key.subjectId(), acc.sum, acc.last)));
        return result;
    }

    private record PairKey(String profileId, String subjectId) {}

    private static final class Accumulator {
        private double sum;
        private Instant last;

        void add(double weight, Instant timestamp) {
            sum += weight;
            if (last == null || timestamp.isAfter(last)) {
                last = timestamp;
            }
        }
    }
}
