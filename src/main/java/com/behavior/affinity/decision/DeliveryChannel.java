package com.behavior.affinity.decision;

/**
 * Abstract delivery channel attached to a recommendation. The engine never
 * sends anything itself.
 */
public enum DeliveryChannel {
    PUSH_NOTIFICATION,
    EMAIL_DIGEST,
    IN_APP_BANNER,
    NONE
}
