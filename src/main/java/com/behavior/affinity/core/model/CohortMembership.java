package com.behavior.affinity.core.model;

import java.util.Objects;

/**
 * A cohort (segment) entry denormalized onto a profile record.
 */
public record CohortMembership(String id, String name) {

    public CohortMembership {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
    }
}
