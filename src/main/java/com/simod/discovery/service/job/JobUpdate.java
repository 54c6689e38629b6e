package com.simod.discovery.service.job;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A set of field assignments applied atomically together with a status check.
 *
 * A {@code null} value clears the field. {@link #increment(JobField)} is only
 * meaningful for numeric fields.
 */
public final class JobUpdate {

    private final Map<JobField, Object> assignments = new EnumMap<>(JobField.class);
    private final Set<JobField> increments = EnumSet.noneOf(JobField.class);

    private JobUpdate() {
    }

    /**
     * Starts an update that moves the job to the given status.
     */
    public static JobUpdate toStatus(JobStatus status) {
        return new JobUpdate().set(JobField.STATUS, Objects.requireNonNull(status, "status"));
    }

    /**
     * Starts an update that keeps the current status.
     */
    public static JobUpdate fields() {
        return new JobUpdate();
    }

    public JobUpdate set(JobField field, Object value) {
        increments.remove(field);
        assignments.put(field, value);
        return this;
    }

    public JobUpdate clear(JobField field) {
        return set(field, null);
    }

    public JobUpdate increment(JobField field) {
        assignments.remove(field);
        increments.add(field);
        return this;
    }

    public Map<JobField, Object> assignments() {
        return Collections.unmodifiableMap(assignments);
    }

    public Set<JobField> increments() {
        return Collections.unmodifiableSet(increments);
    }

    /**
     * Applies this update to a detached record in place.
     */
    public Job applyTo(Job job) {
        assignments.forEach((field, value) -> field.write(job, value));
        for (JobField field : increments) {
            Number current = (Number) field.read(job);
            field.write(job, current == null ? 1 : current.intValue() + 1);
        }
        return job;
    }

    @Override
    public String toString() {
        return "JobUpdate{set=" + assignments.keySet() + ", increment=" + increments + "}";
    }
}
