package com.behavior.affinity.api;

import com.behavior.affinity.decision.PredictedEvent;
import com.behavior.affinity.decision.Prediction;

/**
 * Next likely action for one subject, as returned by the read path.
 */
public record PredictionView(PredictedEvent predictedEvent, double probability) {

    static PredictionView of(Prediction prediction) {
        return new PredictionView(prediction.event(), prediction.probability());
    }
}
