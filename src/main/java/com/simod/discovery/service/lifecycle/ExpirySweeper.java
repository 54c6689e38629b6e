package com.simod.discovery.service.lifecycle;

import com.simod.discovery.service.artifact.ArtifactStore;
import com.simod.discovery.service.config.MetricsConfig;
import com.simod.discovery.service.config.RetentionConfig;
import com.simod.discovery.service.job.Job;
import com.simod.discovery.service.job.JobRepository;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Periodically removes jobs past their retention window.
 *
 * Each job is cleaned independently: it is marked EXPIRED, its artifacts are
 * deleted, then its record. A second pass removes artifact namespaces left
 * without a record, once they are older than the orphan grace period.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpirySweeper {

    private final JobRepository jobRepository;
    private final ArtifactStore artifactStore;
    private final DiscoveryLifecycleManager lifecycleManager;
    private final RetentionConfig retentionConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${discovery.retention.sweep-interval-ms:60000}",
            initialDelayString = "${discovery.retention.sweep-interval-ms:60000}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Expiry sweep failed", e);
        }
    }

    /**
     * Runs one sweep cycle.
     */
    public SweepReport sweep() {
        Timer.Sample sample = Timer.start(metricsConfig.getRegistry());
        try {
            Instant now = clock.instant();
            Tally expired = sweepExpiredJobs(now);
            Tally orphans = sweepOrphanedArtifacts(now);

            SweepReport report = new SweepReport(expired.removed(), orphans.removed(), expired.failures() + orphans.failures());
            if (!report.isEmpty()) {
                log.info("Expiry sweep: {} expired, {} orphaned namespaces removed, {} failures",
                        report.expired(), report.orphansRemoved(), report.failures());
            }
            return report;
        } finally {
            sample.stop(metricsConfig.getSweepTimer());
        }
    }

    // ==================== Expired Jobs ====================

    private Tally sweepExpiredJobs(Instant now) {
        List<Job> expired = jobRepository.findExpired(now);
        int removed = 0;
        int failures = 0;
        for (Job job : expired) {
            try {
                if (lifecycleManager.purge(job)) {
                    removed++;
                }
            } catch (Exception e) {
                failures++;
                log.warn("Failed to expire job {}: {}", job.getId(), e.getMessage());
            }
        }
        return new Tally(removed, failures);
    }

    // ==================== Orphaned Artifacts ====================

    private Tally sweepOrphanedArtifacts(Instant now) {
        Instant cutoff = now.minus(retentionConfig.getOrphanGrace());
        int removed = 0;
        int failures = 0;
        for (Map.Entry<String, Instant> namespace : artifactStore.listNamespaces().entrySet()) {
            String jobId = namespace.getKey();
            if (namespace.getValue().isAfter(cutoff)) {
                continue;
            }
            try {
                if (jobRepository.findById(jobId).isEmpty() && artifactStore.deleteNamespace(jobId)) {
                    removed++;
                    log.debug("Removed orphaned artifacts of {}", jobId);
                }
            } catch (Exception e) {
                failures++;
                log.warn("Failed to remove orphaned artifacts of {}: {}", jobId, e.getMessage());
            }
        }
        return new Tally(removed, failures);
    }

    private record Tally(int removed, int failures) {
    }
}
