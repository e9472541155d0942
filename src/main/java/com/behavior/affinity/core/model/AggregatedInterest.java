package com.behavior.affinity.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Sum of event weights for one (profile, subject) pair within a window,
 * together with the latest event time of the pair.
 */
public record AggregatedInterest(
        String profileId,
        String subjectId,
        double incomingScore,
        Instant lastEventTime
) {
    public AggregatedInterest {
        Objects.requireNonNull(profileId, "profileId is required");
        Objects.requireNonNull(subjectId, "subjectId is required");
        Objects.requireNonNull(lastEventTime, "lastEventTime is required");
        if (incomingScore < 0.0 || Double.isNaN(incomingScore)) {
            throw new IllegalArgumentException("incomingScore must be non-negative, was " + incomingScore);
        }
    }
}
