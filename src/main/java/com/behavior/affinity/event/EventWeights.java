package com.behavior.affinity.event;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Static lookup of the weight each event type contributes to interest.
 * Event types without a weight contribute nothing.
 */
public final class EventWeights {

    private final Map<String, Double> weights;

    private EventWeights(Map<String, Double> weights) {
        weights.forEach((name, weight) -> {
            Objects.requireNonNull(name, "event type name is required");
            if (weight == null || weight < 0.0 || weight.isNaN()) {
                throw new IllegalArgumentException("weight of '" + name + "' must be non-negative, was " + weight);
            }
        });
        this.weights = Map.copyOf(weights);
    }

    public static EventWeights of(Map<String, Double> weights) {
        return new EventWeights(weights);
    }

    public OptionalDouble weightOf(String eventTypeName) {
        Double weight = weights.get(eventTypeName);
        return weight != null ? OptionalDouble.of(weight) : OptionalDouble.empty();
    }

    public Map<String, Double> asMap() {
        return weights;
    }
}
