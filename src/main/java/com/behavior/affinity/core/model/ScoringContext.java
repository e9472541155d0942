package com.behavior.affinity.core.model;

import java.util.Objects;

/**
 * The (journey map, journey stage, model) partition under which a batch run
 * writes its scores.
 */
public record ScoringContext(String contextMapId, String contextStageId, String modelId) {

    public static final String DEFAULT_MAP = "default-journey";
    public static final String DEFAULT_STAGE = "default-stage";
    public static final String DEFAULT_MODEL = "interest-decay-v1";

    public ScoringContext {
        Objects.requireNonNull(contextMapId, "contextMapId is required");
        Objects.requireNonNull(contextStageId, "contextStageId is required");
        Objects.requireNonNull(modelId, "modelId is required");
        if (contextMapId.isBlank() || contextStageId.isBlank() || modelId.isBlank()) {
            throw new IllegalArgumentException("context components must not be blank");
        }
    }

    public static ScoringContext defaults() {
        return new ScoringContext(DEFAULT_MAP, DEFAULT_STAGE, DEFAULT_MODEL);
    }
}
