package com.behavior.affinity.decision;

import java.util.Objects;
import java.util.Set;

/**
 * Runs the predictive stage, then feeds its output to the prescriptive stage.
 */
public class DecisionPipeline {

    private final PredictiveEngine predictiveEngine;
    private final PrescriptiveEngine prescriptiveEngine;

    public DecisionPipeline() {
        this(new PredictiveEngine(), new PrescriptiveEngine());
    }

    public DecisionPipeline(PredictiveEngine predictiveEngine, PrescriptiveEngine prescriptiveEngine) {
        this.predictiveEngine = Objects.requireNonNull(predictiveEngine, "predictiveEngine is required");
        this.prescriptiveEngine = Objects.requireNonNull(prescriptiveEngine, "prescriptiveEngine is required");
    }

    public Decision decide(double interestScore, Set<String> personas) {
        Prediction prediction = predictiveEngine.predict(interestScore, personas);
        Prescription prescription = prescriptiveEngine.recommend(prediction.event(), interestScore);
        return new Decision(interestScore, prediction, prescription);
    }

    public PredictiveEngine getPredictiveEngine() {
        return predictiveEngine;
    }
}
