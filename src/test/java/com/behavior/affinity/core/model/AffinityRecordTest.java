package com.behavior.affinity.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AffinityRecordTest {

    private static final AffinityKey KEY = AffinityKey.of("t1", "p1", "AAPL", ScoringContext.defaults());
    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    @Test
    void builder_rejectsInterestOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> base().interestScore(1.0).build());
        assertThrows(IllegalArgumentException.class, () -> base().interestScore(-0.1).build());
    }

    @Test
    void builder_rejectsNegativeRaw() {
        assertThrows(IllegalArgumentException.class, () -> base().rawScore(-1.0).build());
    }

    @Test
    void decisionColumns_areOptional() {
        AffinityRecord record = base().build();

        assertFalse(record.hasDecision());
        assertNull(record.getNextBestAction());

        AffinityRecord decided = record.toBuilder().nextBestAction("WAIT").nbaConfidence(0.0).build();
        assertTrue(decided.hasDecision());
        assertEquals(record.getRawScore(), decided.getRawScore());
    }

    @Test
    void key_rejectsBlankComponents() {
        assertThrows(IllegalArgumentException.class,
                () -> new AffinityKey("t1", "p1", " ", "m", "s", "v1"));
        assertThrows(NullPointerException.class,
                () -> AffinityKey.of("t1", null, "AAPL", ScoringContext.defaults()));
    }

    @Test
    void key_exposesItsContext() {
        assertEquals(ScoringContext.defaults(), KEY.context());
        assertEquals("interest-decay-v1", KEY.modelId());
    }

    @Test
    void profile_personasFollowCohortOrder() {
        Profile profile = new Profile("t1", "p1", "fp1", List.of(
                new CohortMembership("c2", "High-Frequency Traders"),
                new CohortMembership("c1", "Active in last 1 months")));

        assertEquals(List.of("High-Frequency Traders", "Active in last 1 months"), List.copyOf(profile.personas()));
        assertTrue(profile.isInCohort("c1"));
        assertFalse(profile.isInCohort("c3"));
    }

    private static AffinityRecord.Builder base() {
        return AffinityRecord.builder()
                .key(KEY)
                .rawScore(10.0)
                .interestScore(10.0 / 110.0)
                .lastInteractionAt(T0)
                .updatedAt(T0);
    }
}
