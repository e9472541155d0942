package com.behavior.affinity.decision;

import java.util.Objects;

/**
 * Both stages of the pipeline for a single score: what the user will likely
 * do, and what the system should do about it.
 */
public record Decision(double interestScore, Prediction prediction, Prescription prescription) {

    public Decision {
        Objects.requireNonNull(prediction, "prediction is required");
        Objects.requireNonNull(prescription, "prescription is required");
    }
}
