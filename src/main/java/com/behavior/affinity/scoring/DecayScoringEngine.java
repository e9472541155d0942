package com.behavior.affinity.scoring;

import com.behavior.affinity.core.model.AffinityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Folds incoming event weight into a stored raw score using exponential
 * half-life decay, and normalizes raw scores to a bounded interest score.
 *
 * <p>Formula:</p>
 * <pre>
 * elapsedDays = max((incomingTime - priorTime) / 1 day, 0)
 * newRaw      = priorRaw * 0.5 ^ (elapsedDays / halfLifeDays) + incomingScore
 * interest    = newRaw / (newRaw + K)
 * </pre>
 *
 * <p>Decay is measured between the stored last interaction and the newest
 * incoming event, never against the wall clock, so replaying an aggregate
 * does not decay the stored value further. {@code K} is the half-saturation
 * point: a raw score of {@code K} maps to an interest of 0.5. Both constants
 * are shared across all subjects so interest scores stay comparable.</p>
 */
public class DecayScoringEngine {
    private static final Logger log = LoggerFactory.getLogger(DecayScoringEngine.class);

    /** Reference half-life of interest, in days. */
    public static final double DEFAULT_HALF_LIFE_DAYS = 7.0;

    /** Raw score at which the interest score reaches 0.5. */
    public static final double DEFAULT_K_FACTOR = 100.0;

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final double halfLifeDays;
    private final double kFactor;

    /**
     * Creates an engine with the reference half-life (7 days) and K (100).
     */
    public DecayScoringEngine() {
        this(DEFAULT_HALF_LIFE_DAYS, DEFAULT_K_FACTOR);
    }

    /**
     * Creates an engine with deployment-specific constants.
     *
     * @param halfLifeDays days after which an untouched raw score halves
     * @param kFactor      half-saturation constant of the normalization
     */
    public DecayScoringEngine(double halfLifeDays, double kFactor) {
        if (!(halfLifeDays > 0.0) || Double.isInfinite(halfLifeDays)) {
            throw new IllegalArgumentException("halfLifeDays must be positive and finite");
        }
        if (!(kFactor > 0.0) || Double.isInfinite(kFactor)) {
            throw new IllegalArgumentException("kFactor must be positive and finite");
        }
        this.halfLifeDays = halfLifeDays;
        this.kFactor = kFactor;
    }

    /**
     * Computes the new raw score after folding an incoming aggregate into a prior one.
     *
     * @param priorRaw      the stored raw score, or 0 when there is no prior record
     * @param priorTime     the stored last interaction, or null when there is no prior record
     * @param incomingScore summed weight of the new events
     * @param incomingTime  time of the newest incoming event
     * @return the new raw score, never negative
     */
    public double computeNewRaw(double priorRaw, Instant priorTime, double incomingScore, Instant incomingTime) {
        requireNonNegative(priorRaw, "priorRaw");
        requireNonNegative(incomingScore, "incomingScore");
        if (priorTime == null) {
            return incomingScore;
        }
        double decayed = decayedRaw(priorRaw, priorTime, incomingTime);
        double newRaw = decayed + incomingScore;

        log.trace("Decay: prior={} decayed={} incoming={} new={}", priorRaw, decayed, incomingScore, newRaw);
        return newRaw;
    }

    /**
     * Decays a raw score from {@code from} to {@code to}. Negative elapsed time
     * (clock skew, out-of-order events) is clamped to zero, so the score is
     * never amplified.
     */
    public double decayedRaw(double raw, Instant from, Instant to) {
        requireNonNegative(raw, "raw");
        return raw * decayFactor(elapsedDays(from, to));
    }

    /**
     * Multiplier applied to a raw score after {@code elapsedDays} without events.
     */
    public double decayFactor(double elapsedDays) {
        double days = Math.max(elapsedDays, 0.0);
        return Math.pow(0.5, days / halfLifeDays);
    }

    /**
     * Normalizes a raw score into {@code [0, 1)}: {@code raw / (raw + K)}.
     * Monotonically increasing with diminishing returns.
     */
    public double normalize(double raw) {
        requireNonNegative(raw, "raw");
        if (Double.isInfinite(raw)) {
            return Math.nextDown(1.0);
        }
        double interest = raw / (raw + kFactor);
        // rounding can reach 1.0 for raw values many orders above K
        return interest < 1.0 ? interest : Math.nextDown(1.0);
    }

    /**
     * Returns the interest of a stored record as it would be at {@code asOf}
     * if no further events arrived. Nothing is written.
     */
    public double effectiveInterest(AffinityRecord record, Instant asOf) {
        return normalize(decayedRaw(record.getRawScore(), record.getLastInteractionAt(), asOf));
    }

    public double getHalfLifeDays() {
        return halfLifeDays;
    }

    public double getKFactor() {
        return kFactor;
    }

    private static double elapsedDays(Instant from, Instant to) {
        double days = Duration.between(from, to).toMillis() / 1000.0 / SECONDS_PER_DAY;
        return Math.max(days, 0.0);
    }

    private static void requireNonNegative(double value, String name) {
        if (value < 0.0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(name + " must be non-negative, was " + value);
        }
    }
}
