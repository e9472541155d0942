package com.behavior.affinity.decision;

/**
 * The canonical score boundaries and probabilities of the predictive table.
 *
 * <pre>
 * [hot, 1)    execution or research, by persona
 * [warm, hot) monitoring
 * [0, warm)   disengagement
 * </pre>
 *
 * @param hotThreshold               lower bound of the high-intent tier
 * @param warmThreshold              lower bound of the monitoring tier
 * @param boostThreshold             score from which execution gets the boosted probability
 * @param executionProbability       probability of an execution prediction
 * @param boostedExecutionProbability probability of an execution prediction at or above {@code boostThreshold}
 * @param researchProbability        probability of a research prediction
 * @param monitoringProbability      probability of a monitoring prediction
 * @param disengagementProbability   probability of a disengagement prediction
 */
public record DecisionThresholds(
        double hotThreshold,
        double warmThreshold,
        double boostThreshold,
        double executionProbability,
        double boostedExecutionProbability,
        double researchProbability,
        double monitoringProbability,
        double disengagementProbability
) {
    public static final double DEFAULT_HOT = 0.5;
    public static final double DEFAULT_WARM = 0.1;
    public static final double DEFAULT_BOOST = 0.9;

    public DecisionThresholds {
        if (!(warmThreshold > 0.0 && warmThreshold < hotThreshold && hotThreshold < 1.0)) {
            throw new IllegalArgumentException(
                    "thresholds must satisfy 0 < warm < hot < 1, got warm=" + warmThreshold + " hot=" + hotThreshold);
        }
        if (boostThreshold < hotThreshold || boostThreshold > 1.0) {
            throw new IllegalArgumentException("boostThreshold must be in [hot, 1], was " + boostThreshold);
        }
        requireProbability(executionProbability, "executionProbability");
        requireProbability(boostedExecutionProbability, "boostedExecutionProbability");
        requireProbability(researchProbability, "researchProbability");
        requireProbability(monitoringProbability, "monitoringProbability");
        requireProbability(disengagementProbability, "disengagementProbability");
    }

    /**
     * Reference table: hot 0.5, warm 0.1, execution 0.90 (0.95 from 0.9),
     * research 0.85, monitoring 0.65, disengagement 0.90.
     */
    public static DecisionThresholds defaults() {
        return new DecisionThresholds(DEFAULT_HOT, DEFAULT_WARM, DEFAULT_BOOST,
                0.90, 0.95, 0.85, 0.65, 0.90);
    }

    private static void requireProbability(double p, String name) {
        if (!(p > 0.0 && p <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in (0, 1], was " + p);
        }
    }
}
