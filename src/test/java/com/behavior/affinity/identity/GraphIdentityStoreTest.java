package com.behavior.affinity.identity;

import com.behavior.affinity.core.model.CohortMembership;
import com.behavior.affinity.core.model.Profile;
import com.behavior.affinity.exception.PersistenceException;
import com.behavior.affinity.graph.StubGraphConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GraphIdentityStore using a stub GraphConnection.
 */
class GraphIdentityStoreTest {

    private static final String COHORTS_JSON =
            "[{\"id\":\"c1\",\"name\":\"Active in last 1 months\"},{\"id\":\"c9\",\"name\":\"High-Frequency Traders\"}]";

    private StubGraphConnection connection;
    private GraphIdentityStore store;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        store = new GraphIdentityStore(connection);
    }

    @Test
    void findTenantIdByName_queriesByName() {
        connection.queryResults = List.of(Map.of("id", "t1"));

        assertEquals(Optional.of("t1"), store.findTenantIdByName("Acme Brokerage"));
        assertEquals("Acme Brokerage", connection.lastParams().get("name"));
    }

    @Test
    void findCohortId_scansMembershipsOfTenantProfiles() {
        connection.queryResults = List.of(
                Map.of("cohorts", "[]"),
                Map.of("cohorts", COHORTS_JSON));

        assertEquals(Optional.of("c9"), store.findCohortId("t1", "High-Frequency Traders"));
        assertEquals(Optional.empty(), store.findCohortId("t1", "Dormant"));
    }

    @Test
    void findProfile_deserializesCohorts() {
        connection.queryResults = List.of(Map.of("fingerprintId", "fp-1", "cohorts", COHORTS_JSON));

        Profile profile = store.findProfile("t1", "p1").orElseThrow();

        assertEquals("fp-1", profile.fingerprintId());
        assertEquals(new CohortMembership("c1", "Active in last 1 months"), profile.cohorts().get(0));
        assertTrue(profile.personas().contains("High-Frequency Traders"));
    }

    @Test
    void findByFingerprint_matchesOnEventIdentifier() {
        connection.queryResults = List.of(Map.of("profileId", "p1", "cohorts", COHORTS_JSON));

        Profile profile = store.findByFingerprint("t1", "fp-1").orElseThrow();

        assertEquals("p1", profile.profileId());
        assertEquals("fp-1", profile.fingerprintId());
        assertTrue(connection.lastQuery().contains("fingerprintId: $fingerprintId"));
        assertEquals("fp-1", connection.lastParams().get("fingerprintId"));
    }

    @Test
    void findProfile_corruptCohortsFail() {
        connection.queryResults = List.of(Map.of("fingerprintId", "fp-1", "cohorts", "{not json"));

        assertThrows(PersistenceException.class, () -> store.findProfile("t1", "p1"));
    }

    @Test
    void saveProfile_writesIdListAndJson() {
        store.saveProfile(new Profile("t1", "p1", "fp-1", List.of(
                new CohortMembership("c1", "Active in last 1 months"))));

        Map<String, Object> params = connection.lastParams();
        assertEquals(List.of("c1"), params.get("cohortIds"));
        assertEquals("[{\"id\":\"c1\",\"name\":\"Active in last 1 months\"}]", params.get("cohorts"));
    }

    @Test
    void driverFailure_isWrapped() {
        connection.failure = new IllegalStateException("down");

        assertThrows(PersistenceException.class, () -> store.findTenantIdByName("Acme"));
    }
}
