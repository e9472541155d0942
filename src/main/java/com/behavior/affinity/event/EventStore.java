package com.behavior.affinity.event;

import com.behavior.affinity.core.model.AggregatedInterest;
import com.behavior.affinity.core.model.TimeWindow;
import com.behavior.affinity.identity.ResolvedScope;

import java.util.List;

/**
 * Append-only store of tracking events, queried by window.
 */
public interface EventStore {

    /**
     * Sums event weights per (profile, subject) for events in the window whose
     * profile belongs to the scope's cohort. Events without a subject or without
     * a weight for their type are excluded.
     *
     * @return one entry per pair, empty if nothing qualifies
     */
    List<AggregatedInterest> aggregate(TimeWindow window, ResolvedScope scope);
}
