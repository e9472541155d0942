package com.behavior.affinity.identity;

import com.behavior.affinity.core.model.CohortMembership;
import com.behavior.affinity.core.model.Profile;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory identity store for tests and embedded use.
 */
public class InMemoryIdentityStore implements IdentityStore {

    private final Map<String, String> tenantIdsByName = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Profile>> profilesByTenant = new ConcurrentHashMap<>();

    public InMemoryIdentityStore addTenant(String tenantId, String tenantName) {
        tenantIdsByName.put(tenantName, tenantId);
        return this;
    }

    public InMemoryIdentityStore addProfile(Profile profile) {
        profilesByTenant.computeIfAbsent(profile.tenantId(), t -> new ConcurrentHashMap<>())
                .put(profile.profileId(), profile);
        return this;
    }

    @Override
    public Optional<String> findTenantIdByName(String tenantName) {
        return Optional.ofNullable(tenantIdsByName.get(tenantName));
    }

    @Override
    public Optional<String> findCohortId(String tenantId, String cohortName) {
        return profilesByTenant.getOrDefault(tenantId, Map.of()).values().stream()
                .flatMap(p -> p.cohorts().stream())
                .filter(c -> c.name().equals(cohortName))
                .map(CohortMembership::id)
                .findFirst();
    }

    @Override
    public Optional<Profile> findProfile(String tenantId, String profileId) {
        return Optional.ofNullable(profilesByTenant.getOrDefault(tenantId, Map.of()).get(profileId));
    }

    @Override
    public Optional<Profile> findByFingerprint(String tenantId, String fingerprintId) {
        return profilesByTenant.getOrDefault(tenantId, Map.of()).values().stream()
                .filter(p -> p.fingerprintId().equals(fingerprintId))
                .findFirst();
    }
}
