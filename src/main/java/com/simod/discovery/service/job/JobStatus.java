package com.simod.discovery.service.job;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a discovery job.
 *
 * <pre>
 * PENDING  -> RUNNING    task picked up by a worker
 * RUNNING  -> SUCCEEDED  worker reported success
 * RUNNING  -> FAILED     worker reported failure, or processing timed out
 * RUNNING  -> PENDING    worker lost, requeued with bounded retries
 * any      -> EXPIRED    retention window elapsed, or deleted
 * </pre>
 */
public enum JobStatus {

    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    EXPIRED;

    private static final Set<JobStatus> ACTIVE = EnumSet.of(PENDING, RUNNING);

    /**
     * Whether the job is still waiting for or undergoing processing.
     */
    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    /**
     * Whether no further worker-driven transition can happen.
     */
    public boolean isTerminal() {
        return !isActive();
    }
}
