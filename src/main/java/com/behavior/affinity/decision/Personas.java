package com.behavior.affinity.decision;

/**
 * Persona labels the decision tables react to.
 */
public final class Personas {

    /** Profiles that trade often; high interest predicts execution rather than research. */
    public static final String HIGH_FREQUENCY_TRADERS = "High-Frequency Traders";

    private Personas() {
    }
}
