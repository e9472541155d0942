package com.behavior.affinity.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Stored interest of one profile in one subject under one scoring context.
 * Immutable; every write produces a new instance through {@link #toBuilder()}.
 *
 * <p>The decision columns ({@code predictedUserEvent} through
 * {@code nbaConfidence}) are written by the batch path only and are null until
 * the first batch decision lands.</p>
 */
public final class AffinityRecord {

    private final AffinityKey key;
    private final double rawScore;
    private final double interestScore;
    private final Instant lastInteractionAt;
    private final String predictedUserEvent;
    private final Double predictionProbability;
    private final String nextBestAction;
    private final Double nbaConfidence;
    private final Instant updatedAt;

    private AffinityRecord(Builder builder) {
        this.key = Objects.requireNonNull(builder.key, "key is required");
        this.lastInteractionAt = Objects.requireNonNull(builder.lastInteractionAt, "lastInteractionAt is required");
        if (builder.rawScore < 0.0 || Double.isNaN(builder.rawScore)) {
            throw new IllegalArgumentException("rawScore must be non-negative, was " + builder.rawScore);
        }
        if (builder.interestScore < 0.0 || builder.interestScore >= 1.0 || Double.isNaN(builder.interestScore)) {
            throw new IllegalArgumentException("interestScore must be in [0, 1), was " + builder.interestScore);
        }
        this.rawScore = builder.rawScore;
        this.interestScore = builder.interestScore;
        this.predictedUserEvent = builder.predictedUserEvent;
        this.predictionProbability = builder.predictionProbability;
        this.nextBestAction = builder.nextBestAction;
        this.nbaConfidence = builder.nbaConfidence;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : Instant.now();
    }

    public AffinityKey getKey() {
        return key;
    }

    public String getTenantId() {
        return key.tenantId();
    }

    public String getProfileId() {
        return key.profileId();
    }

    public String getSubjectId() {
        return key.subjectId();
    }

    public double getRawScore() {
        return rawScore;
    }

    public double getInterestScore() {
        return interestScore;
    }

    public Instant getLastInteractionAt() {
        return lastInteractionAt;
    }

    public String getPredictedUserEvent() {
        return predictedUserEvent;
    }

    public Double getPredictionProbability() {
        return predictionProbability;
    }

    public String getNextBestAction() {
        return nextBestAction;
    }

    public Double getNbaConfidence() {
        return nbaConfidence;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean hasDecision() {
        return nextBestAction != null;
    }

    public Builder toBuilder() {
        return new Builder()
                .key(key)
                .rawScore(rawScore)
                .interestScore(interestScore)
                .lastInteractionAt(lastInteractionAt)
                .predictedUserEvent(predictedUserEvent)
                .predictionProbability(predictionProbability)
                .nextBestAction(nextBestAction)
                .nbaConfidence(nbaConfidence)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AffinityKey key;
        private double rawScore;
        private double interestScore;
        private Instant lastInteractionAt;
        private String predictedUserEvent;
        private Double predictionProbability;
        private String nextBestAction;
        private Double nbaConfidence;
        private Instant updatedAt;

        public Builder key(AffinityKey key) {
            this.key = key;
            return this;
        }

        public Builder rawScore(double rawScore) {
            this.rawScore = rawScore;
            return this;
        }

        public Builder interestScore(double interestScore) {
            this.interestScore = interestScore;
            return this;
        }

        public Builder lastInteractionAt(Instant lastInteractionAt) {
            this.lastInteractionAt = lastInteractionAt;
            return this;
        }

        public Builder predictedUserEvent(String predictedUserEvent) {
            this.predictedUserEvent = predictedUserEvent;
            return this;
        }

        public Builder predictionProbability(Double predictionProbability) {
            this.predictionProbability = predictionProbability;
            return this;
        }

        public Builder nextBestAction(String nextBestAction) {
            this.nextBestAction = nextBestAction;
            return this;
        }

        public Builder nbaConfidence(Double nbaConfidence) {
            this.nbaConfidence = nbaConfidence;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public AffinityRecord build() {
            return new AffinityRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AffinityRecord that = (AffinityRecord) o;
        return Double.compare(that.rawScore, rawScore) == 0
                && Double.compare(that.interestScore, interestScore) == 0
                && key.equals(that.key)
                && lastInteractionAt.equals(that.lastInteractionAt)
                && Objects.equals(predictedUserEvent, that.predictedUserEvent)
                && Objects.equals(predictionProbability, that.predictionProbability)
                && Objects.equals(nextBestAction, that.nextBestAction)
                && Objects.equals(nbaConfidence, that.nbaConfidence)
                && updatedAt.equals(that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, rawScore, interestScore, lastInteractionAt, updatedAt);
    }

    @Override
    public String toString() {
        return "AffinityRecord{" +
                "profileId='" + key.profileId() + '\'' +
                ", subjectId='" + key.subjectId() + '\'' +
                ", rawScore=" + rawScore +
                ", interestScore=" + interestScore +
                ", lastInteractionAt=" + lastInteractionAt +
                ", nextBestAction=" + nextBestAction +
                '}';
    }
}
