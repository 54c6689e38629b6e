package com.simod.discovery.service.exception;

import com.simod.discovery.service.job.JobStatus;

/**
 * A transition was requested from a status that does not allow it.
 */
public class InvalidTransitionException extends DiscoveryException {

    public static final String CODE = "INVALID_TRANSITION";

    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Cannot move discovery " + jobId + " from " + from + " to " + to, jobId, CODE);
    }
}
