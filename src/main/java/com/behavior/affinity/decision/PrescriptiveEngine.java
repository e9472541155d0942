package com.behavior.affinity.decision;

import com.behavior.affinity.exception.DecisionTableGapException;

import java.util.Locale;

/**
 * Next Best Action: maps a predicted user action to the intervention the
 * system should make. Independent of persona.
 *
 * <p>The switch below has no default branch, so a new {@link PredictedEvent}
 * constant does not compile until it gets a rule here.</p>
 */
public class PrescriptiveEngine {

    /**
     * Recommends a system action.
     *
     * @param predictedEvent output of the {@link PredictiveEngine}
     * @param interestScore  the score that produced the prediction, quoted in reasons
     * @return the prescription
     * @throws DecisionTableGapException if no predicted event is given
     */
    public Prescription recommend(PredictedEvent predictedEvent, double interestScore) {
        if (predictedEvent == null) {
            throw new DecisionTableGapException("No prescriptive rule for a missing predicted event");
        }
        return switch (predictedEvent) {
            case ORDER_CREATED -> new Prescription(
                    RecommendedAction.STRONG_BUY_ALERT,
                    DeliveryChannel.PUSH_NOTIFICATION,
                    0.95,
                    "High intent detected. Nudge to execute order.");
            case TICKER_VIEW -> new Prescription(
                    RecommendedAction.SEND_ANALYST_REPORT,
                    DeliveryChannel.EMAIL_DIGEST,
                    0.85,
                    "User is interested but needs validation. Send report.");
            case WATCHLIST_ADD -> new Prescription(
                    RecommendedAction.WATCHLIST_SUGGESTION,
                    DeliveryChannel.IN_APP_BANNER,
                    0.70,
                    "User is in consideration phase. Suggest monitoring.");
            case IGNORE_CONTENT -> new Prescription(
                    RecommendedAction.WAIT,
                    DeliveryChannel.NONE,
                    0.0,
                    String.format(Locale.ROOT, "Score (%.2f) is too low for intervention.", interestScore));
        };
    }
}
