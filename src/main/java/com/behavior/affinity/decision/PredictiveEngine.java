package com.behavior.affinity.decision;

import com.behavior.affinity.exception.DecisionTableGapException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Next Likely Action: forecasts what the user will do next from the interest
 * score and the profile's personas.
 *
 * <p>The table is total over {@code [0, 1)}; every score lands in exactly one
 * tier. Anything outside that range (including NaN) is a
 * {@link DecisionTableGapException}.</p>
 */
public class PredictiveEngine {
    private static final Logger log = LoggerFactory.getLogger(PredictiveEngine.class);

    private final DecisionThresholds thresholds;

    public PredictiveEngine() {
        this(DecisionThresholds.defaults());
    }

    public PredictiveEngine(DecisionThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds is required");
    }

    /**
     * Predicts the next user action.
     *
     * @param interestScore normalized interest in {@code [0, 1)}
     * @param personas      persona labels of the profile (may be empty)
     * @return the prediction
     * @throws DecisionTableGapException if the score is outside {@code [0, 1)}
     */
    public Prediction predict(double interestScore, Set<String> personas) {
        Tier tier = tierOf(interestScore);
        Prediction prediction = switch (tier) {
            case HOT -> isHighFrequencyTrader(personas)
                    ? new Prediction(PredictedEvent.ORDER_CREATED, interestScore >= thresholds.boostThreshold()
                            ? thresholds.boostedExecutionProbability()
                            : thresholds.executionProbability())
                    : new Prediction(PredictedEvent.TICKER_VIEW, thresholds.researchProbability());
            case WARM -> new Prediction(PredictedEvent.WATCHLIST_ADD, thresholds.monitoringProbability());
            case COLD -> new Prediction(PredictedEvent.IGNORE_CONTENT, thresholds.disengagementProbability());
        };
        log.trace("prediction score={} tier={} event={} probability={}",
                interestScore, tier, prediction.event(), prediction.probability());
        return prediction;
    }

    /**
     * Classifies a score into its tier of the table.
     */
    Tier tierOf(double interestScore) {
        if (Double.isNaN(interestScore) || interestScore < 0.0 || interestScore >= 1.0) {
            throw new DecisionTableGapException(
                    "Interest score " + interestScore + " is outside the predictive table domain [0, 1)");
        }
        if (interestScore >= thresholds.hotThreshold()) {
            return Tier.HOT;
        }
        if (interestScore >= thresholds.warmThreshold()) {
            return Tier.WARM;
        }
        return Tier.COLD;
    }

    public DecisionThresholds getThresholds() {
        return thresholds;
    }

    private static boolean isHighFrequencyTrader(Set<String> personas) {
        return personas != null && personas.contains(Personas.HIGH_FREQUENCY_TRADERS);
    }

    enum Tier { HOT, WARM, COLD }
}
