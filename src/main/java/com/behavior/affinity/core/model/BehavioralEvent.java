package com.behavior.affinity.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A tracking event as exposed by the upstream event store.
 *
 * @param profileIdentifier the event-side profile identifier (fingerprint)
 * @param timestamp         when the event happened
 * @param eventTypeName     metric name, joined against the weight table
 * @param subject           the entity of interest; null or blank events are noise
 */
public record BehavioralEvent(
        String profileIdentifier,
        Instant timestamp,
        String eventTypeName,
        String subject
) {
    public BehavioralEvent {
        Objects.requireNonNull(profileIdentifier, "profileIdentifier is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(eventTypeName, "eventTypeName is required");
    }

    public boolean hasSubject() {
        return subject != null && !subject.isBlank();
    }
}
