package com.simod.discovery.service.job;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Document store for discovery job records.
 *
 * Implementations must make {@link #updateIfStatus} a single atomic
 * compare-and-set: concurrent transitions of the same job never interleave.
 * Every method returns detached copies.
 */
public interface JobRepository {

    /**
     * Persists a new record.
     *
     * @param job the record, with its id already assigned
     * @return the stored record
     * @throws com.simod.discovery.service.exception.StorageException if the store is unavailable
     *         or a record with the same id exists
     */
    Job insert(Job job);

    Optional<Job> findById(String id);

    List<Job> findAll();

    List<Job> findByStatus(JobStatus status);

    /**
     * Finds every record whose retention window ended at or before {@code now},
     * whatever its status.
     */
    List<Job> findExpired(Instant now);

    /**
     * Applies {@code update} only if the record currently has one of the
     * {@code expected} statuses.
     *
     * @return the updated record, or empty if the record is absent or its
     *         status did not match
     */
    Optional<Job> updateIfStatus(String id, Collection<JobStatus> expected, JobUpdate update);

    default Optional<Job> updateIfStatus(String id, JobStatus expected, JobUpdate update) {
        return updateIfStatus(id, Set.of(expected), update);
    }

    /**
     * Deletes a record.
     *
     * @return true if a record was removed
     */
    boolean delete(String id);

    /**
     * Number of stored records, EXPIRED ones included.
     */
    long count();
}
