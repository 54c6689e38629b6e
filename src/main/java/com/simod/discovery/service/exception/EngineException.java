package com.simod.discovery.service.exception;

/**
 * The discovery engine failed while processing a job.
 *
 * A normal job outcome: it is recorded on the job as FAILED and never
 * surfaces as a server error.
 */
public class EngineException extends DiscoveryException {

    public static final String CODE = "ENGINE_ERROR";

    public EngineException(String message, String jobId) {
        super(message, jobId, CODE);
    }

    public EngineException(String message, String jobId, Throwable cause) {
        super(message, jobId, CODE, cause);
    }
}
