package com.behavior.affinity.store;

import com.behavior.affinity.core.model.AffinityKey;
import com.behavior.affinity.core.model.AffinityRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of raw and normalized interest per
 * (tenant, profile, subject, context). Implementations surface every
 * storage failure as {@link com.behavior.affinity.exception.PersistenceException}.
 */
public interface AffinityStore {

    Optional<AffinityRecord> get(AffinityKey key);

    /**
     * Creates or updates the score columns of a record. Existing decision
     * columns are kept; {@code updatedAt} is overwritten.
     */
    void upsert(AffinityKey key, double rawScore, double interestScore, Instant lastInteractionAt);

    /**
     * Writes the decision columns of an existing record.
     *
     * @throws com.behavior.affinity.exception.PersistenceException if no record exists for the key
     */
    void upsertDecision(AffinityKey key, String predictedEvent, double probability,
                        String nextBestAction, double confidence);

    /**
     * All records of a tenant with {@code interestScore >= minInterestScore},
     * highest interest first.
     */
    List<AffinityRecord> scan(String tenantId, double minInterestScore);

    /**
     * All records of one profile, highest interest first.
     */
    List<AffinityRecord> scanByProfile(String tenantId, String profileId);

    /**
     * Profiles interested in a subject at or above {@code minScore}, highest
     * interest first. A profile scored under several contexts appears once,
     * with its highest-interest record, so the result holds at most
     * {@code limit} distinct profiles.
     */
    List<AffinityRecord> findInterested(String tenantId, String subjectId, double minScore, int limit);

    /**
     * @return true if a record was removed
     */
    boolean delete(AffinityKey key);

    /**
     * Writes a record back exactly as given, decision columns and timestamps included.
     */
    void restore(AffinityRecord record);

    /**
     * Deletes at most {@code limit} records whose stored interest is strictly below the threshold.
     *
     * @return the number of records deleted
     */
    int deleteBelow(double threshold, int limit);

    /**
     * Deletes at most {@code limit} records whose interest, decayed from
     * {@code lastInteractionAt} to {@code asOf}, is strictly below the threshold.
     * Stored scores of surviving records are left untouched.
     *
     * @return the number of records deleted
     */
    int deleteDecayedBelow(double threshold, Instant asOf, double halfLifeDays, double kFactor, int limit);
}
