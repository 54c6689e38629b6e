package com.simod.discovery.service.job;

import java.time.Instant;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Mutable fields of a {@link Job} that a status transition may touch.
 *
 * Each constant knows its document field name and how to read and write it on
 * a detached record, so one {@link JobUpdate} can be applied by any store.
 */
public enum JobField {

    STATUS("status", Job::getStatus, (job, value) -> job.setStatus((JobStatus) value)),
    STARTED_AT("startedAt", Job::getStartedAt, (job, value) -> job.setStartedAt((Instant) value)),
    COMPLETED_AT("completedAt", Job::getCompletedAt, (job, value) -> job.setCompletedAt((Instant) value)),
    EXPIRES_AT("expiresAt", Job::getExpiresAt, (job, value) -> job.setExpiresAt((Instant) value)),
    OUTPUT_PATH("outputPath", Job::getOutputPath, (job, value) -> job.setOutputPath((String) value)),
    ERROR_DETAIL("errorDetail", Job::getErrorDetail, (job, value) -> job.setErrorDetail((String) value)),
    NOTIFIED("notified", Job::isNotified, (job, value) -> job.setNotified((Boolean) value)),
    ATTEMPTS("attempts", Job::getAttempts, (job, value) -> job.setAttempts((Integer) value)),
    DISPATCHED_AT("dispatchedAt", Job::getDispatchedAt, (job, value) -> job.setDispatchedAt((Instant) value)),
    NEXT_DISPATCH_AT("nextDispatchAt", Job::getNextDispatchAt, (job, value) -> job.setNextDispatchAt((Instant) value)),
    HEARTBEAT_AT("heartbeatAt", Job::getHeartbeatAt, (job, value) -> job.setHeartbeatAt((Instant) value));

    private final String documentField;
    private final Function<Job, Object> getter;
    private final BiConsumer<Job, Object> setter;

    JobField(String documentField, Function<Job, Object> getter, BiConsumer<Job, Object> setter) {
        this.documentField = documentField;
        this.getter = getter;
        this.setter = setter;
    }

    public String documentField() {
        return documentField;
    }

    Object read(Job job) {
        return getter.apply(job);
    }

    void write(Job job, Object value) {
        setter.accept(job, value);
    }
}
