package com.simod.discovery.service.exception;

/**
 * Callback delivery failed. Logged only.
 */
public class NotificationException extends DiscoveryException {

    public static final String CODE = "NOTIFICATION_ERROR";

    public NotificationException(String message, String jobId, Throwable cause) {
        super(message, jobId, CODE, cause);
    }
}
