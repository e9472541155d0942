package com.behavior.affinity.api;

import com.behavior.affinity.decision.DeliveryChannel;
import com.behavior.affinity.decision.Prescription;
import com.behavior.affinity.decision.RecommendedAction;

/**
 * Next best action for one subject, as returned by the read path.
 */
public record DecisionView(RecommendedAction action, DeliveryChannel channel, double confidence, String reason) {

    static DecisionView of(Prescription prescription) {
        return new DecisionView(prescription.action(), prescription.channel(),
                prescription.confidence(), prescription.reason());
    }
}
