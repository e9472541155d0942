package com.behavior.affinity.exception;

/**
 * Base class for all failures raised by the affinity engine.
 * Unchecked, so callers only catch the failures they can act on.
 */
public class AffinityException extends RuntimeException {

    public AffinityException(String message) {
        super(message);
    }

    public AffinityException(String message, Throwable cause) {
        super(message, cause);
    }
}
