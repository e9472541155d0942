package com.behavior.affinity.identity;

import com.behavior.affinity.core.model.CohortMembership;
import com.behavior.affinity.core.model.Profile;
import com.behavior.affinity.exception.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    private static final String COHORT = "Active in last 1 months";

    private InMemoryIdentityStore identities;

    @Mock
    private IdentityStore mockStore;

    @BeforeEach
    void setUp() {
        identities = new InMemoryIdentityStore()
                .addTenant("t1", "Acme Brokerage")
                .addProfile(new Profile("t1", "p1", "fp-1", List.of(
                        new CohortMembership("c1", COHORT),
                        new CohortMembership("c9", "High-Frequency Traders"))))
                .addProfile(new Profile("t1", "p2", "fp-2", List.of()));
    }

    @Test
    void resolve_returnsTenantAndCohortIds() {
        ResolvedScope scope = new IdentityResolver(identities).resolve("Acme Brokerage", COHORT);

        assertEquals(new ResolvedScope("t1", "c1"), scope);
    }

    @Test
    void resolve_unknownTenant() {
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> new IdentityResolver(identities).resolve("Nobody", COHORT));
        assertEquals("Tenant", e.getKind());
        assertEquals("Nobody", e.getName());
    }

    @Test
    void resolve_unknownCohort() {
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> new IdentityResolver(identities).resolve("Acme Brokerage", "Dormant"));
        assertEquals("Cohort", e.getKind());
    }

    @Test
    void resolve_rejectsBlankNames() {
        IdentityResolver resolver = new IdentityResolver(identities);
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(" ", COHORT));
    }

    @Test
    void resolve_cachesSuccessfulLookups() {
        when(mockStore.findTenantIdByName("Acme")).thenReturn(Optional.of("t1"));
        when(mockStore.findCohortId("t1", COHORT)).thenReturn(Optional.of("c1"));
        IdentityResolver resolver = new IdentityResolver(mockStore, ScopeCacheConfig.defaults());

        resolver.resolve("Acme", COHORT);
        resolver.resolve("Acme", COHORT);

        verify(mockStore, times(1)).findCohortId("t1", COHORT);
        assertEquals(1, resolver.cachedScopes());

        resolver.invalidate();
        resolver.resolve("Acme", COHORT);
        verify(mockStore, times(2)).findCohortId("t1", COHORT);
    }

    @Test
    void resolve_doesNotCacheFailures() {
        when(mockStore.findTenantIdByName("Acme")).thenReturn(Optional.empty(), Optional.of("t1"));
        when(mockStore.findCohortId("t1", COHORT)).thenReturn(Optional.of("c1"));
        IdentityResolver resolver = new IdentityResolver(mockStore);

        assertThrows(NotFoundException.class, () -> resolver.resolve("Acme", COHORT));
        assertEquals(new ResolvedScope("t1", "c1"), resolver.resolve("Acme", COHORT));
    }

    @Test
    void resolve_withCacheDisabledAlwaysHitsStore() {
        when(mockStore.findTenantIdByName("Acme")).thenReturn(Optional.of("t1"));
        when(mockStore.findCohortId("t1", COHORT)).thenReturn(Optional.of("c1"));
        IdentityResolver resolver = new IdentityResolver(mockStore, ScopeCacheConfig.disabled());

        resolver.resolve("Acme", COHORT);
        resolver.resolve("Acme", COHORT);

        verify(mockStore, times(2)).findTenantIdByName("Acme");
    }

    @Test
    void personasOf_returnsCohortNames() {
        IdentityResolver resolver = new IdentityResolver(identities);

        assertEquals(Set.of(COHORT, "High-Frequency Traders"), resolver.personasOf("t1", "p1"));
        assertEquals(Set.of(), resolver.personasOf("t1", "p2"));
        assertEquals(Set.of(), resolver.personasOf("t1", "unknown"));
    }

    @Test
    void findProfile_byIdOrFingerprint() {
        IdentityResolver resolver = new IdentityResolver(identities);

        assertEquals("p1", resolver.findProfile("t1", "p1").orElseThrow().profileId());
        assertEquals("p1", resolver.findProfile("t1", "fp-1").orElseThrow().profileId());
        assertTrue(resolver.findProfile("t1", "fp-404").isEmpty());
    }
}
