package com.simod.discovery.service.dispatch;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.simod.discovery.service.job.Job;

import java.time.Instant;
import java.util.Objects;

/**
 * Work item placed on the task queue for one discovery job.
 *
 * Carries artifact references only, never the artifacts themselves.
 */
public record DiscoveryTask(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("log_ref") String logRef,
        @JsonProperty("config_ref") String configRef,
        @JsonProperty("attempt") int attempt,
        @JsonProperty("created_at") Instant createdAt) {

    public DiscoveryTask {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(logRef, "logRef");
    }

    /**
     * Builds the task for the next processing attempt of a job.
     */
    public static DiscoveryTask forJob(Job job, Instant now) {
        return new DiscoveryTask(job.getId(), job.getInputLogPath(), job.getInputConfigPath(),
                job.getAttempts() + 1, now);
    }
}
