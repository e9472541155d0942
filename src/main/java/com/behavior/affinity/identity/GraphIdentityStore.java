package com.behavior.affinity.identity;

import com.behavior.affinity.core.model.CohortMembership;
import com.behavior.affinity.core.model.Profile;
import com.behavior.affinity.exception.PersistenceException;
import com.behavior.affinity.graph.GraphConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * FalkorDB-backed identity store.
 *
 * <p>Tenants are {@code :Tenant {id, name}} nodes. Profiles are
 * {@code :Profile} nodes carrying a {@code cohortIds} list, used for
 * filtering inside aggregation queries, and a {@code cohorts} JSON string
 * with the full memberships.</p>
 */
public class GraphIdentityStore implements IdentityStore {
    private static final Logger log = LoggerFactory.getLogger(GraphIdentityStore.class);

    private static final TypeReference<List<CohortMembership>> COHORT_LIST = new TypeReference<>() {};

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphIdentityStore(GraphConnection connection) {
        this.connection = connection;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Optional<String> findTenantIdByName(String tenantName) {
        String query = """
                MATCH (t:Tenant {name: $name})
                RETURN t.id as id
                LIMIT 1
                """;
        List<Map<String, Object>> rows = run(() -> connection.query(query, Map.of("name", tenantName)));
        return rows.stream().map(r -> (String) r.get("id")).findFirst();
    }

    @Override
    public Optional<String> findCohortId(String tenantId, String cohortName) {
        String query = """
                MATCH (p:Profile {tenantId: $tenantId})
                RETURN p.cohorts as cohorts
                """;
        List<Map<String, Object>> rows = run(() -> connection.query(query, Map.of("tenantId", tenantId)));
        for (Map<String, Object> row : rows) {
            for (CohortMembership cohort : deserializeCohorts((String) row.get("cohorts"))) {
                if (cohort.name().equals(cohortName)) {
                    return Optional.of(cohort.id());
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<Profile> findProfile(String tenantId, String profileId) {
        String query = """
                MATCH (p:Profile {tenantId: $tenantId, profileId: $profileId})
                RETURN p.fingerprintId as fingerprintId, p.cohorts as cohorts
                LIMIT 1
                """;
        List<Map<String, Object>> rows = run(() -> connection.query(query, Map.of(
                "tenantId", tenantId,
                "profileId", profileId
        )));
        return rows.stream().findFirst().map(row -> new Profile(
                tenantId,
                profileId,
                (String) row.get("fingerprintId"),
                deserializeCohorts((String) row.get("cohorts"))));
    }

    @Override
    public Optional<Profile> findByFingerprint(String tenantId, String fingerprintId) {
        String query = """
                MATCH (p:Profile {tenantId: $tenantId, fingerprintId: $fingerprintId})
                RETURN p.profileId as profileId, p.cohorts as cohorts
                LIMIT 1
                """;
        List<Map<String, Object>> rows = run(() -> connection.query(query, Map.of(
                "tenantId", tenantId,
                "fingerprintId", fingerprintId
        )));
        return rows.stream().findFirst().map(row -> new Profile(
                tenantId,
                (String) row.get("profileId"),
                fingerprintId,
                deserializeCohorts((String) row.get("cohorts"))));
    }

    /**
     * Creates or renames a tenant. Identity data is owned upstream; this is
     * used to seed graphs for tooling and integration tests.
     */
    public void saveTenant(String tenantId, String tenantName) {
        String query = """
                MERGE (t:Tenant {id: $id})
                SET t.name = $name
                """;
        run(() -> {
            connection.execute(query, Map.of("id", tenantId, "name", tenantName));
            return null;
        });
    }

    /**
     * Creates or replaces a profile node with its cohort memberships.
     */
    public void saveProfile(Profile profile) {
        String query = """
                MERGE (p:Profile {tenantId: $tenantId, profileId: $profileId})
                SET p.fingerprintId = $fingerprintId,
                    p.cohortIds = $cohortIds,
                    p.cohorts = $cohorts
                """;
        List<String> cohortIds = profile.cohorts().stream().map(CohortMembership::id).toList();
        run(() -> {
            connection.execute(query, Map.of(
                    "tenantId", profile.tenantId(),
                    "profileId", profile.profileId(),
                    "fingerprintId", profile.fingerprintId(),
                    "cohortIds", cohortIds,
                    "cohorts", serializeCohorts(profile.cohorts())
            ));
            return null;
        });
        log.debug("Saved profile {} with {} cohorts", profile.profileId(), cohortIds.size());
    }

    private String serializeCohorts(List<CohortMembership> cohorts) {
        try {
            return objectMapper.writeValueAsString(cohorts);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize cohort memberships", e);
        }
    }

    private List<CohortMembership> deserializeCohorts(String json) {
        if (json == null || json.isEmpty()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, COHORT_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize cohort memberships: {}", e.getMessage());
            throw new PersistenceException("Corrupt cohort memberships on profile node", e);
        }
    }

    private static <T> T run(Supplier<T> call) {
        try {
            return call.get();
        } catch (PersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException("Identity store query failed", e);
        }
    }
}
