package com.behavior.affinity.identity;

import java.util.Objects;

/**
 * Internal identifiers of a tenant and one of its cohorts, resolved once per batch run.
 */
public record ResolvedScope(String tenantId, String cohortId) {

    public ResolvedScope {
        Objects.requireNonNull(tenantId, "tenantId is required");
        Objects.requireNonNull(cohortId, "cohortId is required");
    }
}
