package com.behavior.affinity.api;

/**
 * A profile interested in a subject, for audience building.
 */
public record InterestedProfile(String profileId, double interestScore, double rawScore) {
}
