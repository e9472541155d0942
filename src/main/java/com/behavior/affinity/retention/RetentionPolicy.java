package com.behavior.affinity.retention;

import java.util.Objects;

/**
 * Garbage collection settings for affinity records.
 *
 * @param threshold  records with interest strictly below this are deleted
 * @param batchSize  records deleted per store call
 * @param evaluation which interest is compared against the threshold
 */
public record RetentionPolicy(double threshold, int batchSize, Evaluation evaluation) {

    public static final double DEFAULT_THRESHOLD = 0.05;
    public static final int DEFAULT_BATCH_SIZE = 1000;

    /**
     * Which interest score the collector compares.
     */
    public enum Evaluation {
        /** The score as last written by a batch run. */
        STORED,
        /** The stored raw score decayed to the collection time, without rewriting it. */
        DECAYED
    }

    public RetentionPolicy {
        Objects.requireNonNull(evaluation, "evaluation is required");
        if (Double.isNaN(threshold) || threshold <= 0.0 || threshold >= 1.0) {
            throw new IllegalArgumentException("threshold must be in (0, 1), was " + threshold);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
    }

    /**
     * Threshold 0.05, batches of 1000, stored scores.
     */
    public static RetentionPolicy defaults() {
        return new RetentionPolicy(DEFAULT_THRESHOLD, DEFAULT_BATCH_SIZE, Evaluation.STORED);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double threshold = DEFAULT_THRESHOLD;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Evaluation evaluation = Evaluation.STORED;

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder evaluation(Evaluation evaluation) {
            this.evaluation = evaluation;
            return this;
        }

        public RetentionPolicy build() {
            return new RetentionPolicy(threshold, batchSize, evaluation);
        }
    }
}
