package com.simod.discovery.service.lifecycle;

/**
 * Input of a discovery submission.
 *
 * @param eventLog      mandatory event log
 * @param configuration optional discovery configuration, may be null
 * @param callbackUrl   optional absolute http(s) URL notified on completion, may be null
 */
public record SubmissionRequest(UploadedFile eventLog, UploadedFile configuration, String callbackUrl) {

    public static SubmissionRequest of(UploadedFile eventLog) {
        return new SubmissionRequest(eventLog, null, null);
    }

    public boolean hasConfiguration() {
        return configuration != null;
    }
}
