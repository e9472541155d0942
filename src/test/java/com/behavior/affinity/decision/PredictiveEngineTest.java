package com.behavior.affinity.decision;

import com.behavior.affinity.exception.DecisionTableGapException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PredictiveEngineTest {

    private static final Set<String> TRADER = Set.of(Personas.HIGH_FREQUENCY_TRADERS, "Active in last 1 months");
    private static final Set<String> INVESTOR = Set.of("Long-Term Investors");

    private PredictiveEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PredictiveEngine();
    }

    @Test
    @DisplayName("Hot score with the trader persona predicts an order")
    void hotTraderPredictsOrder() {
        Prediction prediction = engine.predict(0.6, TRADER);

        assertEquals(PredictedEvent.ORDER_CREATED, prediction.event());
        assertEquals(PredictedEvent.Intent.EXECUTION, prediction.event().intent());
        assertEquals(0.90, prediction.probability(), 1e-12);
    }

    @Test
    @DisplayName("Very hot trader gets the boosted probability")
    void veryHotTraderBoosted() {
        assertEquals(0.95, engine.predict(0.92, TRADER).probability(), 1e-12);
    }

    @Test
    @DisplayName("Hot score without the trader persona predicts research")
    void hotNonTraderPredictsResearch() {
        Prediction prediction = engine.predict(0.75, INVESTOR);

        assertEquals(PredictedEvent.TICKER_VIEW, prediction.event());
        assertEquals(0.85, prediction.probability(), 1e-12);
    }

    @Test
    @DisplayName("Warm score predicts monitoring regardless of persona")
    void warmPredictsMonitoring() {
        assertEquals(PredictedEvent.WATCHLIST_ADD, engine.predict(0.3, TRADER).event());
        assertEquals(PredictedEvent.WATCHLIST_ADD, engine.predict(0.3, Set.of()).event());
        assertEquals(0.65, engine.predict(0.3, INVESTOR).probability(), 1e-12);
    }

    @Test
    @DisplayName("Cold score predicts disengagement")
    void coldPredictsDisengagement() {
        Prediction prediction = engine.predict(0.05, TRADER);

        assertEquals(PredictedEvent.IGNORE_CONTENT, prediction.event());
        assertEquals(0.90, prediction.probability(), 1e-12);
    }

    @ParameterizedTest
    @CsvSource({
            "0.0, COLD",
            "0.0999999, COLD",
            "0.1, WARM",
            "0.4999999, WARM",
            "0.5, HOT",
            "0.9999999, HOT"
    })
    @DisplayName("Tier boundaries are inclusive at the lower end")
    void tierBoundaries(double score, PredictiveEngine.Tier expected) {
        assertEquals(expected, engine.tierOf(score));
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.01, 1.0, 1.5, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("Scores outside [0, 1) are a table gap, never defaulted")
    void outOfDomainRejected(double score) {
        assertThrows(DecisionTableGapException.class, () -> engine.predict(score, TRADER));
    }

    @Test
    @DisplayName("Every score in [0, 1) yields exactly one prediction with a valid probability")
    void totality() {
        for (int i = 0; i < 1000; i++) {
            double score = i / 1000.0;
            for (Set<String> personas : List.of(TRADER, INVESTOR, Set.<String>of())) {
                Prediction prediction = engine.predict(score, personas);
                assertNotNull(prediction.event());
                assertTrue(prediction.probability() > 0.0 && prediction.probability() <= 1.0);
            }
        }
    }

    @Test
    @DisplayName("Null personas are treated as none")
    void nullPersonas() {
        assertEquals(PredictedEvent.TICKER_VIEW, engine.predict(0.7, null).event());
    }

    @Test
    @DisplayName("Custom thresholds move the tier boundaries")
    void customThresholds() {
        PredictiveEngine strict = new PredictiveEngine(
                new DecisionThresholds(0.7, 0.2, 0.9, 0.9, 0.95, 0.85, 0.65, 0.9));

        assertEquals(PredictedEvent.WATCHLIST_ADD, strict.predict(0.6, TRADER).event());
        assertEquals(PredictedEvent.IGNORE_CONTENT, strict.predict(0.15, TRADER).event());
    }

    @Test
    @DisplayName("Inconsistent thresholds are rejected")
    void invalidThresholds() {
        assertThrows(IllegalArgumentException.class,
                () -> new DecisionThresholds(0.1, 0.5, 0.9, 0.9, 0.95, 0.85, 0.65, 0.9));
        assertThrows(IllegalArgumentException.class,
                () -> new DecisionThresholds(0.5, 0.1, 0.9, 0.0, 0.95, 0.85, 0.65, 0.9));
    }
}
