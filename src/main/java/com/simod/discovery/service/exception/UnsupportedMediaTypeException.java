package com.simod.discovery.service.exception;

/**
 * The uploaded event log is neither CSV nor XES.
 */
public class UnsupportedMediaTypeException extends ValidationException {

    public static final String CODE = "UNSUPPORTED_MEDIA_TYPE";

    public UnsupportedMediaTypeException(String message) {
        super(message, CODE);
    }
}
