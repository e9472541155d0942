package com.behavior.affinity.decision;

import java.util.Arrays;
import java.util.Optional;

/**
 * Next likely user action. Each value carries the upstream event name it
 * predicts, so a prediction can be checked against the events that follow.
 */
public enum PredictedEvent {
    /** Execution: the user is about to act on the subject. */
    ORDER_CREATED("order-created", Intent.EXECUTION),
    /** Research: the user will look deeper before acting. */
    TICKER_VIEW("ticker-view", Intent.RESEARCH),
    /** Monitoring: interested enough to track, not to act. */
    WATCHLIST_ADD("watchlist-add", Intent.MONITORING),
    /** Disengagement: the user will most likely ignore content about the subject. */
    IGNORE_CONTENT("ignore-content", Intent.DISENGAGEMENT);

    private final String eventName;
    private final Intent intent;

    PredictedEvent(String eventName, Intent intent) {
        this.eventName = eventName;
        this.intent = intent;
    }

    public String eventName() {
        return eventName;
    }

    public Intent intent() {
        return intent;
    }

    /**
     * Looks up a predicted event by its upstream event name.
     */
    public static Optional<PredictedEvent> fromEventName(String eventName) {
        return Arrays.stream(values())
                .filter(e -> e.eventName.equals(eventName))
                .findFirst();
    }

    public enum Intent {
        EXECUTION,
        RESEARCH,
        MONITORING,
        DISENGAGEMENT
    }
}
