package com.behavior.affinity.exception;

/**
 * Raised when a score or predicted event falls outside every branch of a
 * decision table. This is a defect in the table, never a condition to default.
 */
public class DecisionTableGapException extends AffinityException {

    public DecisionTableGapException(String message) {
        super(message);
    }
}
