package com.behavior.affinity.decision;

/**
 * Next best action the system should take for a (profile, subject) pair.
 */
public enum RecommendedAction {
    STRONG_BUY_ALERT,
    SEND_ANALYST_REPORT,
    WATCHLIST_SUGGESTION,
    /** Explicit wait state; the engine chose not to intervene. */
    WAIT
}
