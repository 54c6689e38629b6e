package com.simod.discovery.service.exception;

import com.simod.discovery.service.job.JobStatus;

/**
 * The result of a job was requested while the job is still processing.
 */
public class JobNotReadyException extends DiscoveryException {

    public static final String CODE = "NOT_READY";

    private final JobStatus status;

    public JobNotReadyException(String jobId, JobStatus status) {
        super("Discovery " + jobId + " is still " + status.name().toLowerCase(), jobId, CODE);
        this.status = status;
    }

    public JobStatus getStatus() {
        return status;
    }
}
