package com.simod.discovery.service.exception;

/**
 * Artifact store or job repository unavailable or inconsistent.
 */
public class StorageException extends DiscoveryException {

    public static final String CODE = "STORAGE_ERROR";

    public StorageException(String message) {
        super(message, null, CODE);
    }

    public StorageException(String message, Throwable cause) {
        super(message, null, CODE, cause);
    }

    public StorageException(String message, String jobId, Throwable cause) {
        super(message, jobId, CODE, cause);
    }
}
