package com.simod.discovery.service.exception;

/**
 * Unknown or expired job, or a job artifact that is not available.
 */
public class JobNotFoundException extends DiscoveryException {

    public static final String CODE = "NOT_FOUND";

    public JobNotFoundException(String jobId) {
        super("Discovery not found: " + jobId, jobId, CODE);
    }

    public JobNotFoundException(String message, String jobId) {
        super(message, jobId, CODE);
    }
}
