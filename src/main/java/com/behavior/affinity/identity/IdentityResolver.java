package com.behavior.affinity.identity;

import com.behavior.affinity.core.model.Profile;
import com.behavior.affinity.exception.NotFoundException;
import com.behavior.affinity.graph.InputSanitizer;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps tenant and cohort display names to internal identifiers.
 *
 * <p>Resolution is a lookup followed by a scan of the tenant's profiles, so
 * successful resolutions are cached in Caffeine for the configured TTL.
 * Failures are never cached.</p>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final IdentityStore store;
    private final Cache<ScopeKey, ResolvedScope> cache;

    public IdentityResolver(IdentityStore store) {
        this(store, ScopeCacheConfig.defaults());
    }

    public IdentityResolver(IdentityStore store, ScopeCacheConfig config) {
        this.store = Objects.requireNonNull(store, "store is required");
        Objects.requireNonNull(config, "config is required");
        this.cache = config.enabled()
                ? Caffeine.newBuilder()
                        .maximumSize(config.maxSize())
                        .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                        .build()
                : null;
        log.debug("IdentityResolver initialized: cacheEnabled={}", config.enabled());
    }

    /**
     * Resolves display names to a scope.
     *
     * @throws NotFoundException if the tenant or the cohort does not exist
     */
    public ResolvedScope resolve(String tenantName, String cohortName) {
        InputSanitizer.requireIdentifier(tenantName, "tenantName");
        InputSanitizer.requireIdentifier(cohortName, "cohortName");

        ScopeKey key = new ScopeKey(tenantName, cohortName);
        if (cache != null) {
            ResolvedScope cached = cache.getIfPresent(key);
            if (cached != null) {
                return cached;
            }
        }

        String tenantId = store.findTenantIdByName(tenantName)
                .orElseThrow(() -> NotFoundException.tenant(tenantName));
        String cohortId = store.findCohortId(tenantId, cohortName)
                .orElseThrow(() -> NotFoundException.cohort(cohortName));

        ResolvedScope scope = new ResolvedScope(tenantId, cohortId);
        if (cache != null) {
            cache.put(key, scope);
        }
        log.debug("identity.resolved tenant={} cohort={} tenantId={} cohortId={}",
                tenantName, cohortName, tenantId, cohortId);
        return scope;
    }

    /**
     * Persona labels (cohort display names) of a profile; empty if the profile is unknown.
     */
    public Set<String> personasOf(String tenantId, String profileId) {
        return store.findProfile(tenantId, profileId)
                .map(Profile::personas)
                .orElse(Set.of());
    }

    /**
     * Looks a profile up by its profile id, falling back to its event-side
     * fingerprint so callers holding either identifier reach the same profile.
     */
    public Optional<Profile> findProfile(String tenantId, String profileRef) {
        Optional<Profile> byId = store.findProfile(tenantId, profileRef);
        return byId.isPresent() ? byId : store.findByFingerprint(tenantId, profileRef);
    }

    public void invalidate() {
        if (cache != null) {
            cache.invalidateAll();
        }
    }

    long cachedScopes() {
        return cache != null ? cache.estimatedSize() : 0;
    }

    private record ScopeKey(String tenantName, String cohortName) {}
}
