package com.behavior.affinity.lock;

import com.behavior.affinity.exception.AffinityException;

/**
 * Thrown when a batch run cannot acquire its tenant lock within the configured timeout.
 */
public class LockAcquisitionException extends AffinityException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
