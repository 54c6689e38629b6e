package com.simod.discovery.service.exception;

/**
 * Base exception for discovery job handling.
 *
 * Carries the affected job id (when known) and a stable error code that the
 * REST layer exposes to clients.
 */
public class DiscoveryException extends RuntimeException {

    private final String jobId;
    private final String errorCode;

    public DiscoveryException(String message, String errorCode) {
        this(message, null, errorCode, null);
    }

    public DiscoveryException(String message, String jobId, String errorCode) {
        this(message, jobId, errorCode, null);
    }

    public DiscoveryException(String message, String jobId, String errorCode, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
        this.errorCode = errorCode;
    }

    public String getJobId() {
        return jobId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
