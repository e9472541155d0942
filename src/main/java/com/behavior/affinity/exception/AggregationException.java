package com.behavior.affinity.exception;

/**
 * Thrown when the event store query fails. Aggregation runs before any write,
 * so the affinity store is untouched and the window can simply be retried.
 */
public class AggregationException extends AffinityException {

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
