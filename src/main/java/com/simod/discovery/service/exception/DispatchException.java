package com.simod.discovery.service.exception;

/**
 * The task queue did not accept a task.
 */
public class DispatchException extends DiscoveryException {

    public static final String CODE = "DISPATCH_ERROR";

    public DispatchException(String message, String jobId) {
        super(message, jobId, CODE);
    }

    public DispatchException(String message, String jobId, Throwable cause) {
        super(message, jobId, CODE, cause);
    }
}
