package com.simod.discovery.service.engine;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything the engine needs for one job.
 *
 * @param jobId         job being processed
 * @param eventLog      local path of the uploaded event log
 * @param configuration local path of the configuration, or null when none was uploaded
 * @param workspace     scratch directory owned by the job
 */
public record DiscoveryInput(String jobId, Path eventLog, Path configuration, Path workspace) {

    public DiscoveryInput {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(eventLog, "eventLog");
        Objects.requireNonNull(workspace, "workspace");
    }

    public boolean hasConfiguration() {
        return configuration != null;
    }
}
