package com.simod.discovery.service.exception;

/**
 * Malformed or missing submission input. Never retried.
 */
public class ValidationException extends DiscoveryException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(message, null, CODE);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, null, CODE, cause);
    }

    protected ValidationException(String message, String errorCode) {
        super(message, null, errorCode);
    }
}
