package com.behavior.affinity.decision;

import java.util.Objects;

/**
 * Output of the {@link PredictiveEngine}.
 *
 * @param event       the next likely user action
 * @param probability confidence in the prediction, in {@code (0, 1]}
 */
public record Prediction(PredictedEvent event, double probability) {

    public Prediction {
        Objects.requireNonNull(event, "event is required");
        if (!(probability > 0.0 && probability <= 1.0)) {
            throw new IllegalArgumentException("probability must be in (0, 1], was " + probability);
        }
    }
}
