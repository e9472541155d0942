package com.behavior.affinity.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A customer profile as seen by the engine: its identifiers and the cohorts it
 * belongs to. Cohort display names double as the profile's personas.
 */
public record Profile(
        String tenantId,
        String profileId,
        String fingerprintId,
        List<CohortMembership> cohorts
) {
    public Profile {
        Objects.requireNonNull(tenantId, "tenantId is required");
        Objects.requireNonNull(profileId, "profileId is required");
        Objects.requireNonNull(fingerprintId, "fingerprintId is required");
        cohorts = cohorts != null ? List.copyOf(cohorts) : List.of();
    }

    public boolean isInCohort(String cohortId) {
        return cohorts.stream().anyMatch(c -> c.id().equals(cohortId));
    }

    /**
     * Returns the persona labels of this profile, in cohort order.
     */
    public Set<String> personas() {
        Set<String> names = new LinkedHashSet<>();
        cohorts.forEach(c -> names.add(c.name()));
        return Collections.unmodifiableSet(names);
    }
}
