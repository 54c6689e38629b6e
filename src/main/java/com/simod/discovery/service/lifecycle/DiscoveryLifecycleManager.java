package com.simod.discovery.service.lifecycle;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simod.discovery.service.artifact.ArtifactStore;
import com.simod.discovery.service.config.DispatchConfig;
import com.simod.discovery.service.config.MetricsConfig;
import com.simod.discovery.service.config.RetentionConfig;
import com.simod.discovery.service.dispatch.DiscoveryTask;
import com.simod.discovery.service.dispatch.TaskQueue;
import com.simod.discovery.service.exception.DispatchException;
import com.simod.discovery.service.exception.InvalidTransitionException;
import com.simod.discovery.service.exception.JobNotFoundException;
import com.simod.discovery.service.exception.JobNotReadyException;
import com.simod.discovery.service.exception.StorageException;
import com.simod.discovery.service.exception.UnsupportedMediaTypeException;
import com.simod.discovery.service.exception.ValidationException;
import com.simod.discovery.service.job.Job;
import com.simod.discovery.service.job.JobField;
import com.simod.discovery.service.job.JobOutcome;
import com.simod.discovery.service.job.JobRepository;
import com.simod.discovery.service.job.JobStatus;
import com.simod.discovery.service.job.JobUpdate;
import com.simod.discovery.service.schema.DiscoveryConfigurationValidator;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Owns the state machine of discovery jobs.
 *
 * Every status change goes through {@link JobRepository#updateIfStatus}, so
 * concurrent callers (duplicate deliveries, sweeps, requests) resolve to one
 * winner. Transitions:
 * <pre>
 * PENDING   -> RUNNING              worker picked the task up
 * RUNNING   -> SUCCEEDED | FAILED   worker reported, or processing timed out
 * RUNNING   -> PENDING              worker lost, bounded retries
 * any       -> EXPIRED              retention elapsed or deleted
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiscoveryLifecycleManager {

    static final String CONFIGURATION_NAME = "configuration.yaml";

    private static final Set<JobStatus> NOT_EXPIRED = EnumSet.complementOf(EnumSet.of(JobStatus.EXPIRED));
    private static final Set<String> CALLBACK_SCHEMES = Set.of("http", "https");

    private final JobRepository jobRepository;
    private final ArtifactStore artifactStore;
    private final TaskQueue taskQueue;
    private final DiscoveryConfigurationValidator configurationValidator;
    private final CallbackNotifier callbackNotifier;
    private final RetentionConfig retentionConfig;
    private final DispatchConfig dispatchConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    @PostConstruct
    void registerGauges() {
        metricsConfig.registerStoreGauge(jobRepository::count);
    }

    // ==================== Submission ====================

    /**
     * Validates and stores a submission, records it as PENDING and dispatches it.
     *
     * A dispatch failure leaves the job PENDING for reconciliation and is not
     * reported to the caller.
     *
     * @throws ValidationException if the input is missing or malformed
     * @throws StorageException if the artifacts or the record could not be stored
     */
    public Job submit(SubmissionRequest request) {
        UploadedFile eventLog = request.eventLog();
        if (eventLog == null || eventLog.isEmpty()) {
            throw new ValidationException("An event log file is required");
        }
        EventLogFormat format = EventLogFormat.infer(eventLog.filename(), eventLog.contentType())
                .orElseThrow(() -> new UnsupportedMediaTypeException(
                        "Unsupported event log file type: " + describe(eventLog)));
        ObjectNode configuration = request.hasConfiguration()
                ? configurationValidator.validate(request.configuration().content())
                : null;
        String callbackUrl = validateCallbackUrl(request.callbackUrl());

        String jobId = UUID.randomUUID().toString();
        Job job = store(jobId, eventLog, format, configuration, callbackUrl);

        metricsConfig.getJobsSubmitted().increment();
        log.info("Discovery {} submitted ({} {}, configuration: {})",
                jobId, format, eventLog.size(), configuration != null);

        try {
            return dispatch(job);
        } catch (DispatchException e) {
            log.warn("Dispatch of job {} failed, left PENDING for reconciliation: {}", jobId, e.getMessage());
            metricsConfig.getDispatchFailures().increment();
            return job;
        }
    }

    private Job store(String jobId, UploadedFile eventLog, EventLogFormat format,
                      ObjectNode configuration, String callbackUrl) {
        try {
            String logRef = artifactStore.store(jobId, format.storedName(), eventLog.content());
            String configRef = null;
            if (configuration != null) {
                String logPath = artifactStore.resolve(logRef).toAbsolutePath().toString();
                configRef = artifactStore.store(jobId, CONFIGURATION_NAME,
                        configurationValidator.rewriteForLog(configuration, logPath));
            }

            Instant now = clock.instant();
            return jobRepository.insert(Job.builder()
                    .id(jobId)
                    .status(JobStatus.PENDING)
                    .submittedAt(now)
                    .expiresAt(now.plus(retentionConfig.getWindow()))
                    .inputLogPath(logRef)
                    .inputConfigPath(configRef)
                    .callbackUrl(callbackUrl)
                    .build());
        } catch (StorageException e) {
            discardArtifacts(jobId);
            throw e;
        }
    }

    private void discardArtifacts(String jobId) {
        try {
            artifactStore.deleteNamespace(jobId);
        } catch (StorageException e) {
            log.warn("Could not remove artifacts of rejected submission {}: {}", jobId, e.getMessage());
        }
    }

    private String validateCallbackUrl(String callbackUrl) {
        if (callbackUrl == null || callbackUrl.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(callbackUrl.trim());
            String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!uri.isAbsolute() || !CALLBACK_SCHEMES.contains(scheme) || uri.getHost() == null) {
                throw new ValidationException("Callback URL must be an absolute http or https URL: " + callbackUrl);
            }
            return uri.toString();
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid callback URL: " + callbackUrl, e);
        }
    }

    private static String describe(UploadedFile file) {
        return file.filename() + " (" + file.contentType() + ")";
    }

    // ==================== Dispatch ====================

    /**
     * Hands a PENDING job to the task queue and records the accepted dispatch.
     *
     * @throws DispatchException if the queue did not accept the task
     */
    public Job dispatch(Job job) {
        Instant now = clock.instant();
        taskQueue.enqueue(DiscoveryTask.forJob(job, now));
        log.debug("Job {} dispatched", job.getId());
        return jobRepository.updateIfStatus(job.getId(), JobStatus.PENDING, JobUpdate.fields()
                        .set(JobField.DISPATCHED_AT, now)
                        .clear(JobField.NEXT_DISPATCH_AT))
                .orElse(job);
    }

    // ==================== Queries ====================

    /**
     * Returns a visible job.
     *
     * @throws JobNotFoundException if the job is unknown, expired or past its retention window
     */
    public Job get(String jobId) {
        Instant now = clock.instant();
        return jobRepository.findById(jobId)
                .filter(job -> !job.isExpiredAt(now))
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Returns all visible jobs, oldest first.
     */
    public List<Job> list() {
        Instant now = clock.instant();
        return jobRepository.findAll().stream()
                .filter(job -> !job.isExpiredAt(now))
                .sorted(Comparator.comparing(Job::getSubmittedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * Opens the result artifact of a succeeded job.
     *
     * @throws JobNotReadyException while the job is PENDING or RUNNING
     * @throws JobNotFoundException if the job is unknown, expired, failed or its artifact is gone
     */
    public ResultArtifact openResult(String jobId) {
        Job job = get(jobId);
        if (job.getStatus() == JobStatus.SUCCEEDED) {
            return openArtifact(job, job.getOutputPath());
        }
        if (job.getStatus().isActive()) {
            throw new JobNotReadyException(jobId, job.getStatus());
        }
        throw new JobNotFoundException("Discovery " + jobId + " has no result", jobId);
    }

    /**
     * Returns the configuration the engine runs with: the uploaded one after
     * rewriting, or the generated minimal one.
     */
    public byte[] openConfiguration(String jobId) {
        Job job = get(jobId);
        if (job.getInputConfigPath() == null) {
            String logPath = artifactStore.resolve(job.getInputLogPath()).toAbsolutePath().toString();
            return configurationValidator.minimalFor(logPath);
        }
        try (var in = openArtifact(job, job.getInputConfigPath()).content()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new StorageException("Failed to read configuration", jobId, e);
        }
    }

    private ResultArtifact openArtifact(Job job, String reference) {
        if (reference == null || !artifactStore.exists(reference)) {
            throw new JobNotFoundException("Artifact of discovery " + job.getId() + " is no longer available", job.getId());
        }
        String fileName = reference.substring(reference.lastIndexOf('/') + 1);
        return new ResultArtifact(job.getId(), fileName, artifactStore.open(reference));
    }

    // ==================== Worker Transitions ====================

    /**
     * Claims a PENDING job for processing.
     *
     * @return the RUNNING job, or empty if the job is not PENDING (duplicate or stale delivery)
     */
    public Optional<Job> markRunning(String jobId) {
        Instant now = clock.instant();
        Optional<Job> running = jobRepository.updateIfStatus(jobId, JobStatus.PENDING, JobUpdate.toStatus(JobStatus.RUNNING)
                .set(JobField.STARTED_AT, now)
                .set(JobField.HEARTBEAT_AT, now)
                .increment(JobField.ATTEMPTS));
        running.ifPresent(job -> log.info("Discovery {} running (attempt {})", jobId, job.getAttempts()));
        return running;
    }

    /**
     * Refreshes the liveness signal of a RUNNING job.
     *
     * @return false if the job is no longer RUNNING
     */
    public boolean heartbeat(String jobId) {
        return jobRepository.updateIfStatus(jobId, JobStatus.RUNNING,
                JobUpdate.fields().set(JobField.HEARTBEAT_AT, clock.instant())).isPresent();
    }

    /**
     * Records the outcome of a processing attempt.
     *
     * Reporting on a job that is already terminal returns the stored job
     * unchanged.
     *
     * @throws JobNotFoundException if the job does not exist
     * @throws InvalidTransitionException if the job is PENDING
     */
    public Job reportOutcome(String jobId, JobOutcome outcome) {
        Optional<Job> completed = complete(jobId, outcome);
        if (completed.isPresent()) {
            return completed.get();
        }

        Job current = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (current.getStatus().isTerminal()) {
            log.debug("Ignoring duplicate {} report for job {} already {}", outcome.status(), jobId, current.getStatus());
            return current;
        }
        throw new InvalidTransitionException(jobId, current.getStatus(), outcome.status());
    }

    /**
     * Fails a RUNNING job that exceeded the maximum processing duration.
     *
     * @return the failed job, or empty if it was no longer RUNNING
     */
    public Optional<Job> failStuck(String jobId, String detail) {
        return complete(jobId, JobOutcome.failed(detail));
    }

    /**
     * Returns a RUNNING job whose worker was lost to PENDING, with backoff,
     * or fails it once the attempts are used up.
     *
     * @return the updated job, or empty if it was no longer RUNNING
     */
    public Optional<Job> requeue(String jobId, String reason) {
        Job current = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (current.getStatus() != JobStatus.RUNNING) {
            return Optional.empty();
        }

        int maxAttempts = dispatchConfig.getRetry().getMaxAttempts();
        if (current.getAttempts() >= maxAttempts) {
            log.warn("Job {} lost its worker after {} attempts: {}", jobId, current.getAttempts(), reason);
            return complete(jobId, JobOutcome.failed(
                    "Worker lost after " + current.getAttempts() + " attempts: " + reason));
        }

        Instant nextDispatch = clock.instant().plus(backoff(current.getAttempts()));
        Optional<Job> requeued = jobRepository.updateIfStatus(jobId, JobStatus.RUNNING, JobUpdate.toStatus(JobStatus.PENDING)
                .clear(JobField.STARTED_AT)
                .clear(JobField.HEARTBEAT_AT)
                .clear(JobField.DISPATCHED_AT)
                .set(JobField.NEXT_DISPATCH_AT, nextDispatch));
        requeued.ifPresent(job -> {
            metricsConfig.getJobsRequeued().increment();
            log.warn("Job {} requeued after attempt {}, next dispatch at {}: {}",
                    jobId, job.getAttempts(), nextDispatch, reason);
        });
        return requeued;
    }

    Duration backoff(int attempts) {
        Duration base = dispatchConfig.getRetry().getBackoff();
        int exponent = Math.max(0, Math.min(attempts - 1, 16));
        return base.multipliedBy(1L << exponent);
    }

    private Optional<Job> complete(String jobId, JobOutcome outcome) {
        Instant now = clock.instant();
        JobUpdate update = JobUpdate.toStatus(outcome.status())
                .set(JobField.COMPLETED_AT, now)
                .set(JobField.EXPIRES_AT, now.plus(retentionConfig.getWindow()));
        if (outcome instanceof JobOutcome.Succeeded succeeded) {
            update.set(JobField.OUTPUT_PATH, succeeded.outputPath()).clear(JobField.ERROR_DETAIL);
        } else if (outcome instanceof JobOutcome.Failed failed) {
            update.set(JobField.ERROR_DETAIL, failed.errorDetail()).clear(JobField.OUTPUT_PATH);
        }

        Optional<Job> completed = jobRepository.updateIfStatus(jobId, JobStatus.RUNNING, update);
        completed.ifPresent(this::onCompleted);
        return completed;
    }

    private void onCompleted(Job job) {
        if (job.getStatus() == JobStatus.SUCCEEDED) {
            metricsConfig.getJobsSucceeded().increment();
            log.info("Discovery {} succeeded: {}", job.getId(), job.getOutputPath());
        } else {
            metricsConfig.getJobsFailed().increment();
            log.info("Discovery {} failed: {}", job.getId(), job.getErrorDetail());
        }
        if (job.getCallbackUrl() != null) {
            try {
                callbackNotifier.notifyCompletion(job);
            } catch (TaskRejectedException e) {
                metricsConfig.getNotificationsFailed().increment();
                log.warn("Callback for discovery {} rejected, notification executor is saturated: {}",
                        job.getId(), e.getMessage());
            }
        }
    }

    // ==================== Removal ====================

    /**
     * Deletes a visible job and its artifacts.
     *
     * @return the job as it was before deletion, marked EXPIRED
     * @throws JobNotFoundException if the job is not visible
     */
    public Job delete(String jobId) {
        Job job = get(jobId);
        purge(job);
        return job.toBuilder().status(JobStatus.EXPIRED).outputPath(null).errorDetail(null).build();
    }

    /**
     * Deletes every job and its artifacts.
     *
     * @return number of jobs removed
     */
    public long deleteAll() {
        long deleted = 0;
        for (Job job : jobRepository.findAll()) {
            if (purge(job)) {
                deleted++;
            }
        }
        log.info("Deleted {} discoveries", deleted);
        return deleted;
    }

    /**
     * Retires a job: marks it EXPIRED so it is no longer visible, then removes
     * its artifacts, then its record. A record left behind by a failure is
     * picked up again by the expiry sweep.
     *
     * @return false if the record had already disappeared
     * @throws StorageException if the artifacts or the record could not be removed
     */
    public boolean purge(Job job) {
        String jobId = job.getId();
        if (job.getStatus() != JobStatus.EXPIRED) {
            Optional<Job> expired = jobRepository.updateIfStatus(jobId, NOT_EXPIRED, JobUpdate.toStatus(JobStatus.EXPIRED)
                    .set(JobField.EXPIRES_AT, clock.instant())
                    .clear(JobField.OUTPUT_PATH)
                    .clear(JobField.ERROR_DETAIL));
            if (expired.isEmpty() && jobRepository.findById(jobId).isEmpty()) {
                log.debug("Job {} already removed", jobId);
                artifactStore.deleteNamespace(jobId);
                return false;
            }
        }

        artifactStore.deleteNamespace(jobId);
        boolean removed = jobRepository.delete(jobId);
        if (removed) {
            metricsConfig.getJobsExpired().increment();
            log.info("Discovery {} removed", jobId);
        }
        return removed;
    }
}
