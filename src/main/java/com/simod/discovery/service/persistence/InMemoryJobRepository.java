package com.simod.discovery.service.persistence;

import com.simod.discovery.service.exception.StorageException;
import com.simod.discovery.service.job.Job;
import com.simod.discovery.service.job.JobRepository;
import com.simod.discovery.service.job.JobStatus;
import com.simod.discovery.service.job.JobUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of JobRepository.
 *
 * Thread-safe using ConcurrentHashMap; status transitions run inside
 * {@code computeIfPresent}, which serializes updates per key. Records do not
 * survive a restart, so this backend is meant for tests and single-node
 * development.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "discovery.storage", name = "repository", havingValue = "memory")
public class InMemoryJobRepository implements JobRepository {

    private static final Comparator<Job> BY_SUBMISSION =
            Comparator.comparing(Job::getSubmittedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public Job insert(Job job) {
        Job stored = job.copy();
        if (jobs.putIfAbsent(stored.getId(), stored) != null) {
            throw new StorageException("Discovery already exists: " + stored.getId());
        }
        log.debug("Inserted discovery: {}", stored.getId());
        return stored.copy();
    }

    @Override
    public Optional<Job> findById(String id) {
        return Optional.ofNullable(jobs.get(id)).map(Job::copy);
    }

    @Override
    public List<Job> findAll() {
        return jobs.values().stream()
                .sorted(BY_SUBMISSION)
                .map(Job::copy)
                .toList();
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        return jobs.values().stream()
                .filter(job -> job.getStatus() == status)
                .sorted(BY_SUBMISSION)
                .map(Job::copy)
                .toList();
    }

    @Override
    public List<Job> findExpired(Instant now) {
        return jobs.values().stream()
                .filter(job -> job.getExpiresAt() != null && !job.getExpiresAt().isAfter(now))
                .sorted(BY_SUBMISSION)
                .map(Job::copy)
                .toList();
    }

    @Override
    public Optional<Job> updateIfStatus(String id, Collection<JobStatus> expected, JobUpdate update) {
        AtomicReference<Job> updated = new AtomicReference<>();
        jobs.computeIfPresent(id, (key, current) -> {
            if (!expected.contains(current.getStatus())) {
                return current;
            }
            Job next = update.applyTo(current.copy());
            updated.set(next.copy());
            return next;
        });
        return Optional.ofNullable(updated.get());
    }

    @Override
    public boolean delete(String id) {
        return jobs.remove(id) != null;
    }

    @Override
    public long count() {
        return jobs.size();
    }
}
