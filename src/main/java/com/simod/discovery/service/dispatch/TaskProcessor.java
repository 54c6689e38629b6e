package com.simod.discovery.service.dispatch;

import com.simod.discovery.service.artifact.ArtifactStore;
import com.simod.discovery.service.config.DispatchConfig;
import com.simod.discovery.service.config.MetricsConfig;
import com.simod.discovery.service.engine.DiscoveryEngine;
import com.simod.discovery.service.engine.DiscoveryInput;
import com.simod.discovery.service.exception.EngineException;
import com.simod.discovery.service.job.Job;
import com.simod.discovery.service.job.JobOutcome;
import com.simod.discovery.service.lifecycle.DiscoveryLifecycleManager;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Processes one discovery task to completion.
 *
 * Claims the job (PENDING to RUNNING) before any computation, keeps its
 * heartbeat fresh while the engine runs, stores the produced artifact and
 * reports the outcome. Engine failures become a FAILED outcome and are not
 * retried. An exception escaping {@link #process} means the outcome was not
 * recorded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskProcessor {

    static final String RESULTS_DIR = "results";

    private final DiscoveryLifecycleManager lifecycleManager;
    private final DiscoveryEngine engine;
    private final ArtifactStore artifactStore;
    private final DispatchConfig dispatchConfig;
    private final MetricsConfig metricsConfig;

    private ScheduledExecutorService heartbeats;

    @PostConstruct
    void init() {
        heartbeats = Executors.newSingleThreadScheduledExecutor(runnable -> {
            var thread = new Thread(runnable, "discovery-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    void shutdown() {
        heartbeats.shutdownNow();
    }

    /**
     * Runs a task.
     *
     * @return the outcome recorded, or empty if the job was not claimable
     */
    public Optional<JobOutcome> process(DiscoveryTask task) {
        Optional<Job> claimed = lifecycleManager.markRunning(task.jobId());
        if (claimed.isEmpty()) {
            log.debug("Skipping task for job {}: not pending (duplicate or stale delivery)", task.jobId());
            return Optional.empty();
        }

        Job job = claimed.get();
        ScheduledFuture<?> heartbeat = startHeartbeat(job.getId());
        JobOutcome outcome;
        try {
            outcome = runEngine(job);
        } finally {
            heartbeat.cancel(false);
        }

        lifecycleManager.reportOutcome(job.getId(), outcome);
        return Optional.of(outcome);
    }

    // ==================== Engine ====================

    private JobOutcome runEngine(Job job) {
        String jobId = job.getId();
        Timer.Sample sample = Timer.start(metricsConfig.getRegistry());
        try {
            DiscoveryInput input = new DiscoveryInput(
                    jobId,
                    artifactStore.resolve(job.getInputLogPath()),
                    job.getInputConfigPath() == null ? null : artifactStore.resolve(job.getInputConfigPath()),
                    artifactStore.workspace(jobId));

            Path artifact = engine.discover(input);
            String outputRef = artifactStore.store(jobId, RESULTS_DIR + "/" + artifact.getFileName(), artifact);
            return JobOutcome.succeeded(outputRef);
        } catch (EngineException e) {
            log.warn("Discovery engine failed for job {}: {}", jobId, firstLine(e.getMessage()));
            return JobOutcome.failed(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure while processing job {}", jobId, e);
            return JobOutcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            sample.stop(metricsConfig.getEngineTimer());
        }
    }

    // ==================== Heartbeat ====================

    private ScheduledFuture<?> startHeartbeat(String jobId) {
        long intervalMs = dispatchConfig.getWorker().getHeartbeatInterval().toMillis();
        return heartbeats.scheduleAtFixedRate(() -> beat(jobId), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void beat(String jobId) {
        try {
            if (!lifecycleManager.heartbeat(jobId)) {
                log.debug("Heartbeat for job {} ignored, no longer running", jobId);
            }
        } catch (RuntimeException e) {
            log.warn("Heartbeat for job {} failed: {}", jobId, e.getMessage());
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return null;
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
