package com.behavior.affinity.identity;

import com.behavior.affinity.core.model.Profile;

import java.util.Optional;

/**
 * Read access to tenants, cohorts and profiles. The engine never writes identity data.
 */
public interface IdentityStore {

    Optional<String> findTenantIdByName(String tenantName);

    /**
     * Finds the id of a cohort by display name, scanning the cohort
     * memberships of the tenant's profiles.
     */
    Optional<String> findCohortId(String tenantId, String cohortName);

    Optional<Profile> findProfile(String tenantId, String profileId);

    /**
     * Finds a profile by the identifier its tracking events carry.
     */
    Optional<Profile> findByFingerprint(String tenantId, String fingerprintId);
}
