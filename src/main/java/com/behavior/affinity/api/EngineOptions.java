package com.behavior.affinity.api;

import com.behavior.affinity.core.model.ScoringContext;
import com.behavior.affinity.decision.DecisionThresholds;
import com.behavior.affinity.identity.ScopeCacheConfig;
import com.behavior.affinity.retention.RetentionPolicy;
import com.behavior.affinity.scoring.DecayScoringEngine;

import java.util.Objects;

/**
 * Tuning of an {@link AffinityEngine}. The decay constants and thresholds
 * must be the same for every run against one store, or stored interest
 * scores stop being comparable.
 */
public class EngineOptions {

    private static final int DEFAULT_AUDIENCE_PAGE_SIZE = 50;

    private final double halfLifeDays;
    private final double kFactor;
    private final DecisionThresholds thresholds;
    private final int audiencePageSize;
    private final ScoringContext scoringContext;
    private final RetentionPolicy retentionPolicy;
    private final ScopeCacheConfig scopeCacheConfig;

    private EngineOptions(Builder builder) {
        this.halfLifeDays = builder.halfLifeDays;
        this.kFactor = builder.kFactor;
        this.thresholds = Objects.requireNonNull(builder.thresholds, "thresholds is required");
        this.scoringContext = Objects.requireNonNull(builder.scoringContext, "scoringContext is required");
        this.retentionPolicy = Objects.requireNonNull(builder.retentionPolicy, "retentionPolicy is required");
        this.scopeCacheConfig = Objects.requireNonNull(builder.scopeCacheConfig, "scopeCacheConfig is required");
        if (builder.audiencePageSize <= 0) {
            throw new IllegalArgumentException("audiencePageSize must be > 0");
        }
        this.audiencePageSize = builder.audiencePageSize;
    }

    public double getHalfLifeDays() {
        return halfLifeDays;
    }

    public double getKFactor() {
        return kFactor;
    }

    public DecisionThresholds getThresholds() {
        return thresholds;
    }

    /**
     * Maximum number of profiles returned by an audience query.
     */
    public int getAudiencePageSize() {
        return audiencePageSize;
    }

    /**
     * Context used by batch runs that do not pass one explicitly.
     */
    public ScoringContext getScoringContext() {
        return scoringContext;
    }

    public RetentionPolicy getRetentionPolicy() {
        return retentionPolicy;
    }

    public ScopeCacheConfig getScopeCacheConfig() {
        return scopeCacheConfig;
    }

    public static EngineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double halfLifeDays = DecayScoringEngine.DEFAULT_HALF_LIFE_DAYS;
        private double kFactor = DecayScoringEngine.DEFAULT_K_FACTOR;
        private DecisionThresholds thresholds = DecisionThresholds.defaults();
        private int audiencePageSize = DEFAULT_AUDIENCE_PAGE_SIZE;
        private ScoringContext scoringContext = ScoringContext.defaults();
        private RetentionPolicy retentionPolicy = RetentionPolicy.defaults();
        private ScopeCacheConfig scopeCacheConfig = ScopeCacheConfig.defaults();

        public Builder halfLifeDays(double halfLifeDays) {
            this.halfLifeDays = halfLifeDays;
            return this;
        }

        public Builder kFactor(double kFactor) {
            this.kFactor = kFactor;
            return this;
        }

        public Builder thresholds(DecisionThresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder audiencePageSize(int audiencePageSize) {
            this.audiencePageSize = audiencePageSize;
            return this;
        }

        public Builder scoringContext(ScoringContext scoringContext) {
            this.scoringContext = scoringContext;
            return this;
        }

        public Builder retentionPolicy(RetentionPolicy retentionPolicy) {
            this.retentionPolicy = retentionPolicy;
            return this;
        }

        public Builder scopeCacheConfig(ScopeCacheConfig scopeCacheConfig) {
            this.scopeCacheConfig = scopeCacheConfig;
            return this;
        }

        public EngineOptions build() {
            return new EngineOptions(this);
        }
    }
}
