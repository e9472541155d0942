package com.behavior.affinity.decision;

import java.util.Objects;

/**
 * Output of the {@link PrescriptiveEngine}.
 *
 * @param action     the recommended system action
 * @param channel    where the action should be delivered
 * @param confidence confidence in the recommendation, in {@code [0, 1]}
 * @param reason     human-readable explanation
 */
public record Prescription(RecommendedAction action, DeliveryChannel channel, double confidence, String reason) {

    public Prescription {
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(channel, "channel is required");
        Objects.requireNonNull(reason, "reason is required");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be in [0, 1], was " + confidence);
        }
    }

    public boolean isWait() {
        return action == RecommendedAction.WAIT;
    }
}
