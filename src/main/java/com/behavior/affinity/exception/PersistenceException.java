package com.behavior.affinity.exception;

/**
 * Thrown when a read or write against the affinity store fails.
 */
public class PersistenceException extends AffinityException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
