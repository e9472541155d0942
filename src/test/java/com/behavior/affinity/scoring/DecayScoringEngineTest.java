package com.behavior.affinity.scoring;

import com.behavior.affinity.core.model.AffinityKey;
import com.behavior.affinity.core.model.AffinityRecord;
import com.behavior.affinity.core.model.ScoringContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DecayScoringEngineTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private DecayScoringEngine engine;

    @BeforeEach
    void setUp() {
        engine = new DecayScoringEngine();
    }

    @Nested
    @DisplayName("Decay")
    class Decay {

        @Test
        @DisplayName("One half-life with no incoming score halves the raw score")
        void oneHalfLifeHalvesRaw() {
            double raw = engine.computeNewRaw(100.0, T0, 0.0, T0.plus(Duration.ofDays(7)));

            assertEquals(50.0, raw, 1e-9);
            assertEquals(50.0 / 150.0, engine.normalize(raw), 1e-9);
        }

        @Test
        @DisplayName("Without a prior record the incoming score is the raw score")
        void noPriorUsesIncoming() {
            double raw = engine.computeNewRaw(0.0, null, 100.0, T0);

            assertEquals(100.0, raw, 1e-9);
            assertEquals(0.5, engine.normalize(raw), 1e-9);
        }

        @Test
        @DisplayName("Incoming score is added after decaying the prior")
        void incomingAddedAfterDecay() {
            double raw = engine.computeNewRaw(80.0, T0, 10.0, T0.plus(Duration.ofDays(14)));
            assertEquals(30.0, raw, 1e-9);
        }

        @Test
        @DisplayName("Events older than the stored interaction do not amplify the score")
        void negativeElapsedClampedToZero() {
            double raw = engine.computeNewRaw(40.0, T0, 5.0, T0.minus(Duration.ofDays(3)));
            assertEquals(45.0, raw, 1e-9);
        }

        @Test
        @DisplayName("Decay factor shrinks as time passes")
        void decayIsMonotonic() {
            double previous = engine.decayedRaw(100.0, T0, T0);
            for (int day = 1; day <= 60; day++) {
                double current = engine.decayedRaw(100.0, T0, T0.plus(Duration.ofDays(day)));
                assertTrue(current < previous, "raw score must shrink on day " + day);
                assertTrue(current > 0.0);
                previous = current;
            }
        }

        @Test
        @DisplayName("Custom half-life changes the decay speed")
        void customHalfLife() {
            DecayScoringEngine fast = new DecayScoringEngine(1.0, 100.0);
            assertEquals(25.0, fast.decayedRaw(100.0, T0, T0.plus(Duration.ofDays(2))), 1e-9);
        }

        @Test
        @DisplayName("Negative inputs are rejected")
        void negativeInputsRejected() {
            assertThrows(IllegalArgumentException.class, () -> engine.computeNewRaw(-1.0, T0, 1.0, T0));
            assertThrows(IllegalArgumentException.class, () -> engine.computeNewRaw(1.0, T0, -1.0, T0));
            assertThrows(IllegalArgumentException.class, () -> engine.normalize(Double.NaN));
        }

        @Test
        @DisplayName("Non-positive constants are rejected")
        void invalidConstantsRejected() {
            assertThrows(IllegalArgumentException.class, () -> new DecayScoringEngine(0.0, 100.0));
            assertThrows(IllegalArgumentException.class, () -> new DecayScoringEngine(7.0, -1.0));
        }
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @ParameterizedTest
        @ValueSource(doubles = {0.0, 1e-9, 0.5, 5.0, 100.0, 1_000.0, 1e6, 1e12, 1e300, Double.MAX_VALUE})
        @DisplayName("Interest stays in [0, 1) for any non-negative raw score")
        void boundedBelowOne(double raw) {
            double interest = engine.normalize(raw);
            assertTrue(interest >= 0.0);
            assertTrue(interest < 1.0);
        }

        @Test
        @DisplayName("Infinite raw score maps just below one")
        void infiniteRaw() {
            assertTrue(engine.normalize(Double.POSITIVE_INFINITY) < 1.0);
        }

        @Test
        @DisplayName("Interest increases with raw score")
        void monotonicInRaw() {
            double previous = engine.normalize(0.0);
            for (double raw = 1.0; raw < 10_000.0; raw *= 1.5) {
                double current = engine.normalize(raw);
                assertTrue(current > previous);
                previous = current;
            }
        }

        @Test
        @DisplayName("K is the half-saturation point")
        void kIsHalfSaturation() {
            assertEquals(0.5, engine.normalize(DecayScoringEngine.DEFAULT_K_FACTOR), 1e-12);
            assertEquals(0.9, engine.normalize(900.0), 1e-12);
        }
    }

    @Nested
    @DisplayName("Read-time decay")
    class ReadTimeDecay {

        @Test
        @DisplayName("Effective interest of an untouched record never grows")
        void effectiveInterestDecays() {
            AffinityRecord record = AffinityRecord.builder()
                    .key(AffinityKey.of("t1", "p1", "AAPL", ScoringContext.defaults()))
                    .rawScore(100.0)
                    .interestScore(0.5)
                    .lastInteractionAt(T0)
                    .build();

            double atWrite = engine.effectiveInterest(record, T0);
            double weekLater = engine.effectiveInterest(record, T0.plus(Duration.ofDays(7)));
            double monthLater = engine.effectiveInterest(record, T0.plus(Duration.ofDays(30)));

            assertEquals(0.5, atWrite, 1e-12);
            assertEquals(50.0 / 150.0, weekLater, 1e-12);
            assertTrue(monthLater < weekLater);
        }
    }
}
