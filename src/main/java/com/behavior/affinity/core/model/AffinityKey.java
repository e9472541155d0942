package com.behavior.affinity.core.model;

import java.util.Objects;

/**
 * Composite identity of an affinity record: tenant, profile, subject and the
 * scoring context triple that separates independent funnels for the same pair.
 */
public record AffinityKey(
        String tenantId,
        String profileId,
        String subjectId,
        String contextMapId,
        String contextStageId,
        String modelId
) {
    public AffinityKey {
        requireNonBlank(tenantId, "tenantId");
        requireNonBlank(profileId, "profileId");
        requireNonBlank(subjectId, "subjectId");
        requireNonBlank(contextMapId, "contextMapId");
        requireNonBlank(contextStageId, "contextStageId");
        requireNonBlank(modelId, "modelId");
    }

    /**
     * Builds a key for a (profile, subject) pair under the given scoring context.
     */
    public static AffinityKey of(String tenantId, String profileId, String subjectId, ScoringContext context) {
        Objects.requireNonNull(context, "context is required");
        return new AffinityKey(tenantId, profileId, subjectId,
                context.contextMapId(), context.contextStageId(), context.modelId());
    }

    public ScoringContext context() {
        return new ScoringContext(contextMapId, contextStageId, modelId);
    }

    private static void requireNonBlank(String value, String field) {
        Objects.requireNonNull(value, field + " is required");
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
