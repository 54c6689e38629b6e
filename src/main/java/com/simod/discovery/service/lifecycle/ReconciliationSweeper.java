package com.simod.discovery.service.lifecycle;

import com.simod.discovery.service.config.DispatchConfig;
import com.simod.discovery.service.dispatch.TaskQueue;
import com.simod.discovery.service.exception.DiscoveryException;
import com.simod.discovery.service.job.Job;
import com.simod.discovery.service.job.JobRepository;
import com.simod.discovery.service.job.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Recovers jobs that the normal flow left behind.
 *
 * <ul>
 *   <li>PENDING jobs with no accepted dispatch are dispatched again once past
 *       the grace period and their backoff.</li>
 *   <li>RUNNING jobs past the maximum processing duration are failed.</li>
 *   <li>RUNNING jobs without a recent heartbeat are requeued.</li>
 * </ul>
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "discovery.features", name = "reconciliation-enabled", matchIfMissing = true)
public class ReconciliationSweeper {

    private final JobRepository jobRepository;
    private final DiscoveryLifecycleManager lifecycleManager;
    private final TaskQueue taskQueue;
    private final DispatchConfig dispatchConfig;
    private final Clock clock;

    /**
     * Tasks accepted by a non-durable queue before this instant were lost with
     * the previous process.
     */
    private final Instant startedAt;

    public ReconciliationSweeper(JobRepository jobRepository,
                                 DiscoveryLifecycleManager lifecycleManager,
                                 TaskQueue taskQueue,
                                 DispatchConfig dispatchConfig,
                                 Clock clock) {
        this.jobRepository = jobRepository;
        this.lifecycleManager = lifecycleManager;
        this.taskQueue = taskQueue;
        this.dispatchConfig = dispatchConfig;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @Scheduled(
            fixedDelayString = "${discovery.dispatch.reconciliation.interval-ms:30000}",
            initialDelayString = "${discovery.dispatch.reconciliation.interval-ms:30000}")
    public void scheduledReconcile() {
        try {
            reconcile();
        } catch (Exception e) {
            log.error("Reconciliation sweep failed", e);
        }
    }

    /**
     * Runs one reconciliation cycle.
     */
    public ReconciliationReport reconcile() {
        Instant now = clock.instant();
        int redispatched = 0;
        int requeued = 0;
        int failed = 0;
        int errors = 0;

        for (Job job : jobRepository.findByStatus(JobStatus.PENDING)) {
            if (job.isExpiredAt(now) || !needsDispatch(job, now)) {
                continue;
            }
            try {
                lifecycleManager.dispatch(job);
                redispatched++;
                log.info("Re-dispatched pending job {}", job.getId());
            } catch (DiscoveryException e) {
                errors++;
                log.warn("Re-dispatch of job {} failed: {}", job.getId(), e.getMessage());
            }
        }

        var worker = dispatchConfig.getWorker();
        for (Job job : jobRepository.findByStatus(JobStatus.RUNNING)) {
            try {
                if (isOverdue(job, now)) {
                    if (lifecycleManager.failStuck(job.getId(),
                            "Discovery timed out after " + worker.getMaxProcessing()).isPresent()) {
                        failed++;
                        log.warn("Job {} exceeded maximum processing time {}", job.getId(), worker.getMaxProcessing());
                    }
                } else if (isAbandoned(job, now)) {
                    var updated = lifecycleManager.requeue(job.getId(),
                            "no heartbeat since " + lastSignOfLife(job));
                    if (updated.isPresent()) {
                        if (updated.get().getStatus() == JobStatus.FAILED) {
                            failed++;
                        } else {
                            requeued++;
                        }
                    }
                }
            } catch (DiscoveryException e) {
                errors++;
                log.warn("Reconciliation of running job {} failed: {}", job.getId(), e.getMessage());
            }
        }

        ReconciliationReport report = new ReconciliationReport(redispatched, requeued, failed, errors);
        if (!report.isEmpty()) {
            log.info("Reconciliation: {} re-dispatched, {} requeued, {} failed, {} errors",
                    redispatched, requeued, failed, errors);
        }
        return report;
    }

    // ==================== Predicates ====================

    boolean needsDispatch(Job job, Instant now) {
        boolean undispatched = job.getDispatchedAt() == null
                || (!taskQueue.isDurable() && job.getDispatchedAt().isBefore(startedAt));
        if (!undispatched) {
            return false;
        }
        if (job.getNextDispatchAt() != null) {
            return !job.getNextDispatchAt().isAfter(now);
        }
        Instant graceEnd = job.getSubmittedAt().plus(dispatchConfig.getReconciliation().getPendingGrace());
        return !graceEnd.isAfter(now);
    }

    private boolean isOverdue(Job job, Instant now) {
        Instant started = job.getStartedAt();
        return started != null && !started.plus(dispatchConfig.getWorker().getMaxProcessing()).isAfter(now);
    }

    private boolean isAbandoned(Job job, Instant now) {
        Instant last = lastSignOfLife(job);
        return last != null && !last.plus(dispatchConfig.getWorker().getAckTimeout()).isAfter(now);
    }

    private static Instant lastSignOfLife(Job job) {
        return job.getHeartbeatAt() != null ? job.getHeartbeatAt() : job.getStartedAt();
    }
}
