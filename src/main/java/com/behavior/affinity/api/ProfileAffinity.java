package com.behavior.affinity.api;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Everything the engine knows about one profile: its identifiers, its personas
 * and, per subject, the stored scores with a freshly computed next likely action.
 * Subjects are ordered by interest, highest first. {@code fingerprintId} is null
 * when the profile is unknown to the identity store.
 */
public record ProfileAffinity(
        String tenantId,
        String profileId,
        String fingerprintId,
        Set<String> personas,
        List<SubjectAffinity> subjects
) {

    public ProfileAffinity {
        personas = Set.copyOf(personas);
        subjects = List.copyOf(subjects);
    }

    public record SubjectAffinity(
            String subjectId,
            double rawScore,
            double interestScore,
            Instant lastInteractionAt,
            PredictionView nextLikelyAction
    ) {
    }
}
